package de.htwsaar.streamrelay.cli.command.stream;

import de.htwsaar.streamrelay.cli.di.CliContext;
import de.htwsaar.streamrelay.cli.dto.HttpCallResult;
import de.htwsaar.streamrelay.cli.service.RelayProbeService;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Prüft, ob unter einer Basis-URL ein Relay erreichbar ist.
 *
 * <p>Exit-Codes:
 * - 0: Relay antwortet
 * - 2: Host antwortet, ist aber kein Relay
 * - 1: Netzwerkfehler
 */
@Command(
        name = "probe",
        description = "Check whether a relay is reachable",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {"  probe", "  probe -H https://relay.example"})
public final class ProbeCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Option(
            names = {"-H", "--host"},
            defaultValue = "http://localhost:8080",
            paramLabel = "RELAY_URL",
            description = "Relay base URL (scheme://host:port)")
    private URI host;

    public ProbeCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    RelayProbeService probeService() {
        return new RelayProbeService(ctx.httpClient(), ctx.defaultRequestTimeout());
    }

    @Override
    public Integer call() {
        HttpCallResult result = probeService().probe(host);
        if (result.error() != null) {
            ctx.err().println("[PROBE] Relay unreachable: " + result.error());
            ctx.err().flush();
            return 1;
        }
        if (RelayProbeService.looksLikeRelay(result)) {
            ctx.out().printf("[PROBE] Relay available at %s (HTTP %d)%n", host, result.statusCode());
            ctx.out().flush();
            return 0;
        }
        ctx.err().printf("[PROBE] %s answered HTTP %d but is not a relay%n", host, result.statusCode());
        ctx.err().flush();
        return 2;
    }
}
