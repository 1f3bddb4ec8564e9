package de.htwsaar.streamrelay.relay.service;

import de.htwsaar.streamrelay.relay.domain.Classification;
import de.htwsaar.streamrelay.relay.domain.ResourceKind;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Ordnet Upstream-Antworten ein: Ressourcenart, Erfolg und getarnte HTML-Fehlerseiten.
 */
@Service
public class ResponseClassifier {

    static final String PLAYLIST_MARKER = "#EXTM3U";

    private static final String BOM = "\uFEFF";

    /** Anzahl Zeilen am Anfang einer Playlist, in denen der Marker stehen darf. */
    static final int MARKER_SCAN_LINES = 5;

    private static final Set<String> SEGMENT_EXTENSIONS =
            Set.of("ts", "m4s", "mp4", "key", "jpg", "jpeg", "png", "webp", "html");

    /**
     * @param statusCode  HTTP-Status
     * @param contentType Content-Type oder {@code null}
     * @param path        Pfad der Ziel-URL
     * @return Klassifizierung
     */
    public Classification classify(int statusCode, String contentType, String path) {
        ResourceKind kind = kindOf(contentType, path);
        boolean ok = statusCode >= 200 && statusCode < 300;
        boolean disguised = ok && kind == ResourceKind.SEGMENT && isMarkup(contentType);
        return new Classification(ok, kind, disguised);
    }

    /**
     * Playlists erkennt man an der Endung {@code .m3u8} oder am MIME-Typ, Segmente nur an der Endung.
     *
     * @param contentType Content-Type oder {@code null}
     * @param path        Pfad der Ziel-URL
     * @return Ressourcenart
     */
    public ResourceKind kindOf(String contentType, String path) {
        String p = path == null ? "" : path.toLowerCase(Locale.ROOT);
        String ct = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (p.endsWith(".m3u8") || ct.contains("mpegurl")) return ResourceKind.PLAYLIST;
        int dot = p.lastIndexOf('.');
        if (dot >= 0 && dot > p.lastIndexOf('/') && SEGMENT_EXTENSIONS.contains(p.substring(dot + 1))) {
            return ResourceKind.SEGMENT;
        }
        return ResourceKind.UNKNOWN;
    }

    /**
     * Prüft, ob ein Playlist-Body wirklich eine Playlist ist. BOM und führende Leerzeilen sind erlaubt.
     *
     * @param body Playlist-Text
     * @return {@code true}, wenn {@code #EXTM3U} in einer der ersten Zeilen steht
     */
    public boolean hasPlaylistMarker(String body) {
        if (body == null) return false;
        String text = body.startsWith(BOM) ? body.substring(1) : body;
        String[] lines = text.split("\n", MARKER_SCAN_LINES + 1);
        for (int i = 0; i < Math.min(lines.length, MARKER_SCAN_LINES); i++) {
            if (lines[i].strip().startsWith(PLAYLIST_MARKER)) return true;
        }
        return false;
    }

    private static boolean isMarkup(String contentType) {
        if (contentType == null) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml+xml");
    }
}
