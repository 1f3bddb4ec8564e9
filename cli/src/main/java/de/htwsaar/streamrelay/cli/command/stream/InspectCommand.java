package de.htwsaar.streamrelay.cli.command.stream;

import de.htwsaar.streamrelay.cli.di.CliContext;
import de.htwsaar.streamrelay.common.url.RelayLink;
import de.htwsaar.streamrelay.common.url.RelayUrls;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Zerlegt eine Relay-URL (z. B. aus einer umgeschriebenen Playlist) in Ziel-URL und Header-Hinweise.
 *
 * <p>Exit-Codes: 0 = OK, 3 = keine Relay-URL.</p>
 */
@Command(
        name = "inspect",
        description = "Decode a relay URL into target URL and header hints",
        mixinStandardHelpOptions = true)
public final class InspectCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Parameters(index = "0", paramLabel = "<relayUrl>", description = "Relay URL containing ?url=...")
    private String relayUrl;

    public InspectCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        RelayLink link = RelayUrls.unwrap(relayUrl);
        if (link.targetUrl() == null || link.targetUrl().isBlank()) {
            ctx.err().println("[INSPECT] Not a relay URL (missing url parameter)");
            ctx.err().flush();
            return 3;
        }
        ctx.out().println("Target: " + link.targetUrl());
        Map<String, String> hints = link.hints();
        if (hints.isEmpty()) {
            ctx.out().println("Hints:  (none)");
        } else {
            hints.forEach((name, value) -> ctx.out().printf("Hint:   %s: %s%n", name, value));
        }
        ctx.out().flush();
        return 0;
    }
}
