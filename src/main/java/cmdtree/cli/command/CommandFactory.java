package cmdtree.cli.command;

@FunctionalInterface
public interface CommandFactory {
    CommandNode create(CommandContext context);
}
