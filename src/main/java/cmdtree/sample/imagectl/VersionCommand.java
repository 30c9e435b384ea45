package cmdtree.sample.imagectl;

import cmdtree.cli.command.CommandContext;
import cmdtree.cli.command.CommandNode;
import cmdtree.cli.command.Invocation;

import java.util.concurrent.CompletableFuture;

public class VersionCommand extends CommandNode {
    public static final String VERSION = "1.0";

    public VersionCommand(final CommandContext context) {
        super(context);
    }

    @Override
    public String description() {
        return "Prints the version.";
    }

    @Override
    public boolean printHelpWithNoArgs() {
        return false;
    }

    @Override
    protected CompletableFuture<Void> executeAsync(final Invocation invocation) {
        ioService().writeLine(commandPath().get(0).name() + " " + VERSION);
        return CompletableFuture.completedFuture(null);
    }
}
