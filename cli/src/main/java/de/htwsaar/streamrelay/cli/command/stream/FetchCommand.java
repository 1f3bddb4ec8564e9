package de.htwsaar.streamrelay.cli.command.stream;

import de.htwsaar.streamrelay.cli.di.CliContext;
import de.htwsaar.streamrelay.cli.dto.DownloadResult;
import de.htwsaar.streamrelay.cli.service.RelayDownloadService;
import de.htwsaar.streamrelay.cli.util.HeaderHints;
import de.htwsaar.streamrelay.cli.util.UriUtils;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Lädt eine Playlist oder ein Segment über den Relay herunter.
 *
 * <p>Exit-Codes:
 * <ul>
 *   <li>0 = OK</li>
 *   <li>3 = Client-Validation (kein Request)</li>
 *   <li>4 = HTTP 4xx</li>
 *   <li>2 = HTTP 5xx</li>
 *   <li>1 = Exception/IO</li>
 * </ul>
 */
@Command(
        name = "fetch",
        description = "Download a stream resource through the relay",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  fetch https://cdn.example/show/master.m3u8 -o master.m3u8",
            "  fetch https://cdn.example/show/seg-1.ts -o seg-1.ts -H https://relay.example --overwrite"
        })
public final class FetchCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Parameters(index = "0", paramLabel = "<targetUrl>", description = "Absolute http(s) stream URL")
    private String targetUrl;

    @Option(
            names = {"-o", "--out"},
            required = true,
            paramLabel = "OUT_FILE",
            description = "Local output file path")
    private Path out;

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

    @Option(
            names = {"--overwrite"},
            defaultValue = "false",
            description = "Overwrite existing local file")
    private boolean overwrite;

    public FetchCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    RelayDownloadService downloadService() {
        return new RelayDownloadService(ctx.httpClient(), ctx.defaultRequestTimeout());
    }

    @Override
    public Integer call() {
        Optional<URI> target = UriUtils.parseHttpUri(targetUrl);
        if (target.isEmpty()) {
            return fail("[FETCH] targetUrl must be an absolute http(s) URL");
        }
        if (Files.exists(out) && Files.isDirectory(out)) {
            return fail("[FETCH] Output path is a directory: " + out);
        }
        if (Files.exists(out) && !overwrite) {
            return fail("[FETCH] Output file already exists (use --overwrite): " + out);
        }
        String hints;
        try {
            hints = HeaderHints.encode(referer, headers);
        } catch (IllegalArgumentException e) {
            return fail("[FETCH] " + e.getMessage());
        }

        DownloadResult result = downloadService().download(host, target.get().toString(), hints, out, overwrite);

        if (result.error() != null) {
            ctx.err().printf("[FETCH] Download failed: %s%n", result.error());
            ctx.err().flush();
            return 1;
        }

        int sc = Objects.requireNonNull(result.statusCode(), "statusCode");
        if (sc >= 200 && sc < 300) {
            ctx.out().printf("[FETCH] Downloaded -> %s (%d bytes)%n", out, result.bytesWritten());
            ctx.out().flush();
            return 0;
        }
        if (sc >= 400 && sc < 500) {
            ctx.err().printf("[FETCH] Request rejected (HTTP %d)%n", sc);
            ctx.err().flush();
            return 4;
        }
        ctx.err().printf("[FETCH] Relay or upstream error (HTTP %d)%n", sc);
        ctx.err().flush();
        return 2;
    }

    private int fail(String message) {
        ctx.err().println(message);
        ctx.err().flush();
        return 3;
    }
}
