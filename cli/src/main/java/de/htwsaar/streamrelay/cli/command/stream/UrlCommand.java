package de.htwsaar.streamrelay.cli.command.stream;

import de.htwsaar.streamrelay.cli.di.CliContext;
import de.htwsaar.streamrelay.cli.util.HeaderHints;
import de.htwsaar.streamrelay.cli.util.UriUtils;
import de.htwsaar.streamrelay.common.url.RelayUrls;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Gibt die abspielbare Relay-URL für eine Ziel-URL aus.
 *
 * <p>Exit-Codes: 0 = OK, 3 = ungültige Eingabe.</p>
 */
@Command(
        name = "url",
        description = "Print the relay URL for a stream URL",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  url https://cdn.example/show/master.m3u8",
            "  url https://cdn.example/show/master.m3u8 -H https://relay.example --referer https://megacloud.blog/",
            "  url https://cdn.example/show/master.m3u8 --header Origin=https://megacloud.blog"
        })
public final class UrlCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Parameters(index = "0", paramLabel = "<targetUrl>", description = "Absolute http(s) stream URL")
    private String targetUrl;

    @Option(
            names = {"-H", "--host"},
            defaultValue = "http://localhost:8080",
            paramLabel = "RELAY_URL",
            description = "Relay base URL (scheme://host:port)")
    private URI host;

    @Option(names = "--referer", paramLabel = "REFERER", description = "Referer the relay should try first")
    private String referer;

    @Option(names = "--header", paramLabel = "NAME=VALUE", description = "Additional header hint (repeatable)")
    private List<String> headers;

    public UrlCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        Optional<URI> target = UriUtils.parseHttpUri(targetUrl);
        if (target.isEmpty()) {
            ctx.err().println("[URL] targetUrl must be an absolute http(s) URL");
            ctx.err().flush();
            return 3;
        }
        String hints;
        try {
            hints = HeaderHints.encode(referer, headers);
        } catch (IllegalArgumentException e) {
            ctx.err().println("[URL] " + e.getMessage());
            ctx.err().flush();
            return 3;
        }
        ctx.out().println(RelayUrls.wrap(host.toString(), target.get().toString(), hints));
        ctx.out().flush();
        return 0;
    }
}
