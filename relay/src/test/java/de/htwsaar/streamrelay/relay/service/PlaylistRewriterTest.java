package de.htwsaar.streamrelay.relay.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.streamrelay.common.hints.HeaderHintCodec;
import de.htwsaar.streamrelay.common.url.RelayLink;
import de.htwsaar.streamrelay.common.url.RelayUrls;
import de.htwsaar.streamrelay.relay.domain.RewriteContext;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class PlaylistRewriterTest {

    private static final String RELAY = "http://relay.test";
    private static final String REFERER = "https://megacloud.tv/";

    private final PlaylistRewriter rewriter = new PlaylistRewriter();

    @Test
    void relativeVariantIsWrappedWithWinningReferer() {
        String out = rewriter.rewrite("#EXTM3U\n#EXT-X-STREAM-INF:BANDWIDTH=800000\nlow/index.m3u8", ctx("https://example-cdn.test/master.m3u8"));

        String expected = RELAY + "/stream?url=https%3A%2F%2Fexample-cdn.test%2Flow%2Findex.m3u8&h="
                + URLEncoder.encode(HeaderHintCodec.encodeReferer(REFERER), StandardCharsets.UTF_8);
        assertEquals("#EXTM3U\n#EXT-X-STREAM-INF:BANDWIDTH=800000\n" + expected, out);
    }

    @Test
    void keyUriAttributeIsResolvedAgainstPlaylistDirectory() {
        String out = rewriter.rewrite(
                "#EXT-X-KEY:METHOD=AES-128,URI=\"enc.key\",IV=0x1", ctx("https://cdn.test/show/index.m3u8"));

        String wrapped = RelayUrls.wrap(RELAY, "https://cdn.test/show/enc.key", HeaderHintCodec.encodeReferer(REFERER));
        assertEquals("#EXT-X-KEY:METHOD=AES-128,URI=\"" + wrapped + "\",IV=0x1", out);
    }

    @Test
    void tagsWithoutUriBlankLinesAndLineEndingsArePreserved() {
        String playlist = "#EXTM3U\r\n#EXT-X-TARGETDURATION:10\r\n\r\n#EXTINF:10.0,\r\nseg-1.ts\r\n#EXT-X-ENDLIST\r\n";

        String out = rewriter.rewrite(playlist, ctx("https://cdn.test/show/index.m3u8"));
        String[] in = playlist.split("\n", -1);
        String[] lines = out.split("\n", -1);

        assertEquals(in.length, lines.length);
        assertEquals("#EXTM3U\r", lines[0]);
        assertEquals("#EXT-X-TARGETDURATION:10\r", lines[1]);
        assertEquals("\r", lines[2]);
        assertEquals("#EXTINF:10.0,\r", lines[3]);
        assertTrue(lines[4].startsWith(RELAY + "/stream?url=") && lines[4].endsWith("\r"));
        assertEquals("#EXT-X-ENDLIST\r", lines[5]);
        assertEquals("", lines[6]);
    }

    @Test
    void everyReferenceKindResolvesToAnAbsoluteUrl() {
        RewriteContext ctx = ctx("https://cdn.test:8443/a/b/index.m3u8?token=1");

        assertEquals("https://other.test/x.ts", target(rewriter.rewrite("https://other.test/x.ts", ctx)));
        assertEquals("https://cdn.test:8443/root.ts", target(rewriter.rewrite("/root.ts", ctx)));
        assertEquals("https://edge.test/y.ts", target(rewriter.rewrite("//edge.test/y.ts", ctx)));
        assertEquals("https://cdn.test:8443/a/up.ts", target(rewriter.rewrite("../up.ts", ctx)));
        assertEquals("https://cdn.test:8443/a/b/seg.ts?x=1", target(rewriter.rewrite("seg.ts?x=1", ctx)));
    }

    @Test
    void rewrittenLinksCarryWinningReferer() {
        String out = rewriter.rewrite("seg-1.ts", ctx("https://cdn.test/show/index.m3u8"));

        RelayLink link = RelayUrls.unwrap(out);
        assertEquals(REFERER, HeaderHintCodec.referer(link.hints()).orElseThrow());
    }

    @Test
    void unresolvableReferenceIsLeftUntouched() {
        String playlist = "#EXTM3U\nseg 1|bad.ts\n#EXT-X-MAP:URI=\"in it.mp4\"";

        assertEquals(playlist, rewriter.rewrite(playlist, ctx("https://cdn.test/show/index.m3u8")));
    }

    private static RewriteContext ctx(String playlistUrl) {
        return RewriteContext.of(URI.create(playlistUrl), RELAY, REFERER);
    }

    private static String target(String rewrittenLine) {
        return RelayUrls.unwrap(rewrittenLine).targetUrl();
    }
}
