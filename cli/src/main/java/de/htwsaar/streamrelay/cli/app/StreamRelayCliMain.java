package de.htwsaar.streamrelay.cli.app;

import de.htwsaar.streamrelay.cli.command.root.StreamRelayRootCommand;
import de.htwsaar.streamrelay.cli.di.CliContext;
import de.htwsaar.streamrelay.cli.di.ContextFactory;
import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import picocli.CommandLine;

/**
 * Einstiegspunkt der StreamRelay CLI.
 *
 * <p>Baut gemeinsame Infrastruktur (HTTP-Client, Timeouts) und die Picocli-Command-Struktur
 * inkl. {@link ContextFactory} für Constructor Injection.</p>
 */
public final class StreamRelayCliMain {

    private StreamRelayCliMain() {}

    /**
     * @param args Kommandozeilenargumente (kann leer sein)
     */
    public static void main(String[] args) {
        PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        PrintWriter err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);

        CliContext ctx = new CliContext(
                out,
                err,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                Duration.ofSeconds(90));

        CommandLine cmd = new CommandLine(StreamRelayRootCommand.class, new ContextFactory(ctx));
        cmd.setOut(out);
        cmd.setErr(err);
        System.exit(cmd.execute(args == null ? new String[0] : args));
    }
}
