package de.htwsaar.streamrelay.cli.util;

import de.htwsaar.streamrelay.common.hints.HeaderHintCodec;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Baut Header-Hinweise aus CLI-Optionen ({@code --referer}, {@code --header K=V}).
 */
public final class HeaderHints {
    private HeaderHints() {}

    /**
     * @param referer optionaler Referer
     * @param headers {@code Name=Wert}-Paare
     * @return Base64-Hinweise oder {@code null}, wenn nichts angegeben wurde
     * @throws IllegalArgumentException bei einem Paar ohne {@code =} oder mit leerem Namen
     */
    public static String encode(String referer, List<String> headers) {
        Map<String, String> hints = new LinkedHashMap<>();
        if (referer != null && !referer.isBlank()) {
            hints.put(HeaderHintCodec.REFERER, referer.trim());
        }
        if (headers != null) {
            for (String pair : headers) {
                int eq = pair.indexOf('=');
                if (eq <= 0 || pair.substring(0, eq).isBlank()) {
                    throw new IllegalArgumentException("Header must be NAME=VALUE: " + pair);
                }
                hints.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            }
        }
        return hints.isEmpty() ? null : HeaderHintCodec.encode(hints);
    }
}
