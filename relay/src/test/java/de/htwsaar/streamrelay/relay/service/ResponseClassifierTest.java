package de.htwsaar.streamrelay.relay.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.streamrelay.relay.domain.Classification;
import de.htwsaar.streamrelay.relay.domain.ResourceKind;
import org.junit.jupiter.api.Test;

class ResponseClassifierTest {

    private final ResponseClassifier classifier = new ResponseClassifier();

    @Test
    void playlistByExtensionOrMimeType() {
        assertEquals(ResourceKind.PLAYLIST, classifier.kindOf(null, "/show/master.m3u8"));
        assertEquals(ResourceKind.PLAYLIST, classifier.kindOf("application/vnd.apple.mpegurl", "/playlist"));
        assertEquals(ResourceKind.PLAYLIST, classifier.kindOf("audio/x-mpegURL", "/hls/get"));
    }

    @Test
    void segmentByExtensionOnly() {
        assertEquals(ResourceKind.SEGMENT, classifier.kindOf("video/mp2t", "/seg-1.ts"));
        assertEquals(ResourceKind.SEGMENT, classifier.kindOf(null, "/SEG-1.TS"));
        assertEquals(ResourceKind.SEGMENT, classifier.kindOf(null, "/img/frame.jpg"));
        assertEquals(ResourceKind.UNKNOWN, classifier.kindOf("video/mp2t", "/segment"));
        assertEquals(ResourceKind.UNKNOWN, classifier.kindOf(null, "/dir.ts/file"));
    }

    @Test
    void htmlOnSegmentIsDisguisedError() {
        Classification c = classifier.classify(200, "text/html; charset=utf-8", "/seg-1.ts");

        assertTrue(c.ok());
        assertTrue(c.disguisedError());
        assertFalse(c.acceptable());
        assertTrue(classifier.classify(200, "application/xhtml+xml", "/seg-1.m4s").disguisedError());
    }

    @Test
    void htmlIsOnlyDisguisedForSegments() {
        assertTrue(classifier.classify(200, "text/html", "/video").acceptable());
        assertTrue(classifier.classify(200, "text/html", "/index.m3u8").acceptable());
    }

    @Test
    void nonSuccessStatusIsNotAcceptable() {
        Classification c = classifier.classify(403, "text/html", "/seg-1.ts");

        assertFalse(c.ok());
        assertFalse(c.disguisedError());
        assertFalse(c.acceptable());
        assertTrue(classifier.classify(206, "video/mp2t", "/seg-1.ts").acceptable());
    }

    @Test
    void playlistMarkerToleratesBomAndLeadingBlankLines() {
        assertTrue(classifier.hasPlaylistMarker("#EXTM3U\n#EXT-X-VERSION:3\n"));
        assertTrue(classifier.hasPlaylistMarker("\uFEFF#EXTM3U\r\n"));
        assertTrue(classifier.hasPlaylistMarker("\n\n  #EXTM3U\n"));
    }

    @Test
    void missingMarkerIsDetected() {
        assertFalse(classifier.hasPlaylistMarker("<html><body>blocked</body></html>"));
        assertFalse(classifier.hasPlaylistMarker(""));
        assertFalse(classifier.hasPlaylistMarker(null));
        assertFalse(classifier.hasPlaylistMarker("a\nb\nc\nd\ne\n#EXTM3U\n"));
    }
}
