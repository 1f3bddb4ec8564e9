package de.htwsaar.streamrelay.relay.service;

import static de.htwsaar.streamrelay.relay.UpstreamResponses.isClosed;
import static de.htwsaar.streamrelay.relay.UpstreamResponses.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import de.htwsaar.streamrelay.common.hints.HeaderHintCodec;
import de.htwsaar.streamrelay.relay.config.RefererTable;
import de.htwsaar.streamrelay.relay.domain.RelayPayload;
import de.htwsaar.streamrelay.relay.domain.RelayRequest;
import de.htwsaar.streamrelay.relay.domain.ResourceKind;
import de.htwsaar.streamrelay.relay.domain.UpstreamClient;
import de.htwsaar.streamrelay.relay.domain.UpstreamResponse;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class RelayServiceTest {

    private static final String RELAY = "http://relay.test";
    private static final String PLAYLIST = "#EXTM3U\n#EXTINF:10.0,\nseg-1.ts\n";

    private UpstreamClient upstream;
    private MutableClock clock;
    private RelayService service;

    @BeforeEach
    void setUp() throws IOException {
        upstream = mock(UpstreamClient.class);
        when(upstream.fetch(any(), anyString(), anyMap(), any())).thenAnswer(inv -> text(403, "text/plain", "no"));
        clock = new MutableClock();
        service = new RelayService(
                upstream,
                new CredentialResolver(RefererTable.defaults()),
                new ResponseClassifier(),
                RetryPolicy.defaults(),
                new PlaylistRewriter(),
                clock,
                Duration.ofSeconds(60));
    }

    @Test
    void playlistFromSecondCandidateIsRewritten() throws IOException {
        respond("https://megacloud.tv/", () -> text(200, "application/vnd.apple.mpegurl", PLAYLIST));

        RelayPayload payload = service.relay(request("https://example-cdn.test/show/master.m3u8", Map.of()), RELAY);

        assertEquals(ResourceKind.PLAYLIST, payload.kind());
        assertEquals("https://megacloud.tv/", payload.winningReferer());
        assertTrue(payload.playlist().contains(RELAY + "/stream?url=https%3A%2F%2Fexample-cdn.test%2Fshow%2Fseg-1.ts"));
        assertEquals(List.of("https://megacloud.blog/", "https://megacloud.tv/"), referers(2));
    }

    @Test
    void segmentIsReturnedAsOpenStream() throws IOException {
        UpstreamResponse segment = text(206, "video/mp2t", "abcd");
        when(upstream.fetch(any(), eq("https://megacloud.blog/"), anyMap(), eq("bytes=0-3"))).thenReturn(segment);

        RelayPayload payload = service.relay(
                new RelayRequest(URI.create("https://cdn.test/seg-1.ts"), Map.of(), "bytes=0-3"), RELAY);

        assertEquals(ResourceKind.SEGMENT, payload.kind());
        assertEquals(206, payload.stream().statusCode());
        assertFalse(isClosed(segment));
        payload.close();
        assertTrue(isClosed(segment));
    }

    @Test
    void disguisedHtmlSegmentIsRejectedAndClosed() throws IOException {
        UpstreamResponse html = text(200, "text/html", "<html>blocked</html>");
        when(upstream.fetch(any(), eq("https://megacloud.blog/"), anyMap(), any())).thenReturn(html);
        respond("https://megacloud.tv/", () -> text(200, "video/mp2t", "ts-bytes"));

        RelayPayload payload = service.relay(request("https://cdn.test/seg-1.ts", Map.of()), RELAY);

        assertEquals("https://megacloud.tv/", payload.winningReferer());
        assertTrue(isClosed(html));
    }

    @Test
    void playlistWithoutMarkerIsRejected() throws IOException {
        respond("https://megacloud.blog/", () -> text(200, "application/vnd.apple.mpegurl", "<html>captcha</html>"));
        respond("https://hianime.to/", () -> text(200, "application/x-mpegurl", PLAYLIST));

        RelayPayload payload = service.relay(request("https://cdn.test/index.m3u8", Map.of()), RELAY);

        assertEquals("https://hianime.to/", payload.winningReferer());
    }

    @Test
    void explicitRefererHintIsTriedFirst() throws IOException {
        respond("https://player.test/", () -> text(200, "video/mp2t", "x"));

        service.relay(request("https://cdn.test/a.ts", Map.of("Referer", "https://player.test/")), RELAY);

        assertEquals(List.of("https://player.test/"), referers(1));
    }

    @Test
    void lastObservedStatusIsReported() {
        RelayUpstreamException ex = assertThrows(
                RelayUpstreamException.class, () -> service.relay(request("https://cdn.test/a.ts", Map.of()), RELAY));

        assertEquals(403, ex.getStatusCode());
    }

    @Test
    void successStatusWithUnusableBodyIsReportedAsBadGateway() throws IOException {
        when(upstream.fetch(any(), anyString(), anyMap(), any())).thenAnswer(inv -> text(200, "text/html", "<html/>"));

        RelayUpstreamException ex = assertThrows(
                RelayUpstreamException.class, () -> service.relay(request("https://cdn.test/a.ts", Map.of()), RELAY));

        assertEquals(502, ex.getStatusCode());
    }

    @Test
    void transportFailuresOnEveryAttemptSurfaceAsTransportError() throws IOException {
        when(upstream.fetch(any(), anyString(), anyMap(), any())).thenThrow(new ConnectException("Connection refused"));

        RelayTransportException ex = assertThrows(
                RelayTransportException.class, () -> service.relay(request("https://cdn.test/a.ts", Map.of()), RELAY));

        assertEquals("Connection refused", ex.getMessage());
        verify(upstream, times(5)).fetch(any(), anyString(), anyMap(), any());
    }

    @Test
    void playlistWithOriginHintGetsOriginlessPass() throws IOException {
        Map<String, String> hints = new LinkedHashMap<>();
        hints.put("Origin", "https://player.test");
        hints.put("X-Requested-With", "player");

        assertThrows(RelayUpstreamException.class, () -> service.relay(request("https://cdn.test/i.m3u8", hints), RELAY));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(upstream, times(10)).fetch(any(), anyString(), headers.capture(), any());
        List<Map<String, String>> sent = headers.getAllValues();
        assertEquals("https://player.test", sent.get(0).get("Origin"));
        assertNull(sent.get(9).get("Origin"));
        assertEquals("player", sent.get(9).get("X-Requested-With"));
    }

    @Test
    void segmentsNeverGetOriginlessPass() throws IOException {
        assertThrows(
                RelayUpstreamException.class,
                () -> service.relay(request("https://cdn.test/a.ts", Map.of("Origin", "https://p.test")), RELAY));

        verify(upstream, times(5)).fetch(any(), anyString(), anyMap(), any());
    }

    @Test
    void deadlineStopsFurtherAttempts() throws IOException {
        when(upstream.fetch(any(), anyString(), anyMap(), any())).thenAnswer(inv -> {
            clock.advance(Duration.ofSeconds(40));
            return text(403, "text/plain", "no");
        });

        assertThrows(RelayUpstreamException.class, () -> service.relay(request("https://cdn.test/a.ts", Map.of()), RELAY));

        verify(upstream, times(2)).fetch(any(), anyString(), anyMap(), any());
    }

    @Test
    void refererHintIsNotForwardedAsExtraHeader() {
        Map<String, String> headers =
                RelayService.attemptHeaders(Map.of("referer", "https://r.test/", "Origin", "https://o.test"), true);

        assertTrue(headers.isEmpty());
    }

    @Test
    void playlistCharsetFollowsContentType() {
        assertEquals(StandardCharsets.ISO_8859_1, RelayService.charsetOf("audio/mpegurl; charset=\"ISO-8859-1\""));
        assertEquals(StandardCharsets.UTF_8, RelayService.charsetOf("audio/mpegurl; charset=bogus-42"));
        assertEquals(StandardCharsets.UTF_8, RelayService.charsetOf(null));
    }

    private void respond(String referer, ResponseSupplier supplier) throws IOException {
        when(upstream.fetch(any(), eq(referer), anyMap(), any())).thenAnswer(inv -> supplier.get());
    }

    private List<String> referers(int expectedCalls) throws IOException {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(upstream, times(expectedCalls)).fetch(any(), captor.capture(), anyMap(), any());
        return captor.getAllValues();
    }

    private static RelayRequest request(String url, Map<String, String> hints) {
        return new RelayRequest(URI.create(url), HeaderHintCodec.decode(HeaderHintCodec.encode(hints)), null);
    }

    @FunctionalInterface
    private interface ResponseSupplier {
        UpstreamResponse get();
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
