package de.htwsaar.streamrelay.common.hints;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.streamrelay.common.serialization.JacksonCodec;
import de.htwsaar.streamrelay.common.serialization.StreamRelaySerializationException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec für Header-Hinweise im Query-Parameter {@code h}: ein Base64-kodiertes JSON-Objekt
 * aus Header-Namen und Werten, z. B. {@code {"Referer":"https://megacloud.blog/"}}.
 *
 * <p>Das Dekodieren ist bewusst nachsichtig: ungültiges Base64, kaputtes JSON oder ein
 * JSON-Wert, der kein Objekt ist, ergeben eine leere Map und niemals einen Fehler.</p>
 */
public final class HeaderHintCodec {

    private static final Logger log = LoggerFactory.getLogger(HeaderHintCodec.class);

    /** Schlüssel des Referer-Hinweises. */
    public static final String REFERER = "Referer";

    private HeaderHintCodec() {
        // Utility
    }

    /**
     * Kodiert Header-Hinweise als Base64 (Standard-Alphabet, mit Padding).
     *
     * @param hints Header-Name → Wert (Reihenfolge bleibt erhalten)
     * @return Base64-String des JSON-Objekts
     */
    public static String encode(Map<String, String> hints) {
        String json = JacksonCodec.toJson(hints == null ? Map.of() : hints);
        return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Kurzform für den häufigsten Fall: nur ein Referer.
     *
     * @param referer Referer-Wert
     * @return Base64-String von {@code {"Referer": referer}}
     */
    public static String encodeReferer(String referer) {
        Map<String, String> hints = new LinkedHashMap<>();
        hints.put(REFERER, referer);
        return encode(hints);
    }

    /**
     * Dekodiert den {@code h}-Parameter.
     *
     * @param encoded Base64 (Standard oder URL-safe); darf {@code null} sein
     * @return unveränderliche Map der textuellen, nicht-leeren Werte ohne Steuerzeichen; leer bei jedem Fehler
     */
    public static Map<String, String> decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return Map.of();
        }
        // ein unkodiertes '+' kommt nach dem Query-Parsing als Leerzeichen an
        String normalized = encoded.trim().replace(' ', '+');
        try {
            byte[] raw = isUrlSafe(normalized)
                    ? Base64.getUrlDecoder().decode(normalized)
                    : Base64.getDecoder().decode(normalized);
            JsonNode node = JacksonCodec.readTree(new String(raw, StandardCharsets.UTF_8));
            if (node == null || !node.isObject()) {
                log.debug("Ignoring header hints: not a JSON object");
                return Map.of();
            }
            Map<String, String> hints = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (!value.isTextual() || value.asText().isBlank()) continue;
                if (!isHeaderSafe(field.getKey()) || !isHeaderSafe(value.asText())) {
                    log.debug("Ignoring header hint {}: contains control characters", field.getKey());
                    continue;
                }
                hints.put(field.getKey(), value.asText().trim());
            }
            return Collections.unmodifiableMap(hints);
        } catch (IllegalArgumentException | StreamRelaySerializationException e) {
            log.debug("Ignoring malformed header hints: {}", e.getMessage());
            return Map.of();
        }
    }

    /**
     * Sucht den Referer-Hinweis, unabhängig von der Schreibweise des Schlüssels.
     *
     * @param hints dekodierte Hinweise
     * @return Referer oder leer
     */
    public static Optional<String> referer(Map<String, String> hints) {
        if (hints == null) return Optional.empty();
        return hints.entrySet().stream()
                .filter(e -> REFERER.equalsIgnoreCase(e.getKey()))
                .map(Map.Entry::getValue)
                .filter(v -> !v.isBlank())
                .findFirst();
    }

    /**
     * @param value Header-Name oder -Wert
     * @return {@code false}, wenn der Wert CR, LF oder andere Steuerzeichen enthält
     */
    public static boolean isHeaderSafe(String value) {
        if (value == null) return false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isISOControl(c) && c != '\t') return false;
        }
        return true;
    }

    private static boolean isUrlSafe(String value) {
        return value.indexOf('-') >= 0 || value.indexOf('_') >= 0;
    }
}
