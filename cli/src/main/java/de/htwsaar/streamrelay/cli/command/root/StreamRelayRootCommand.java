package de.htwsaar.streamrelay.cli.command.root;

import de.htwsaar.streamrelay.cli.command.stream.FetchCommand;
import de.htwsaar.streamrelay.cli.command.stream.InspectCommand;
import de.htwsaar.streamrelay.cli.command.stream.ProbeCommand;
import de.htwsaar.streamrelay.cli.command.stream.UrlCommand;
import de.htwsaar.streamrelay.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 *
 * <p>Ohne Subcommand wird die Usage angezeigt.</p>
 */
@Command(
        name = "streamrelay",
        description = "StreamRelay CLI",
        mixinStandardHelpOptions = true,
        subcommands = {
            UrlCommand.class,
            InspectCommand.class,
            ProbeCommand.class,
            FetchCommand.class,
            HelpCommand.class
        })
public final class StreamRelayRootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    /**
     * Konstruktor für Constructor Injection via {@code ContextFactory}.
     *
     * @param ctx CLI-Kontext (Output, HTTP-Client, Timeouts)
     */
    public StreamRelayRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().println("Tipp: Verwende `streamrelay help <command>`.");
        ctx.out().flush();
    }
}
