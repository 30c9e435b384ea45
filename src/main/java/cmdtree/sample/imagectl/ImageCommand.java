package cmdtree.sample.imagectl;

import cmdtree.cli.command.CommandContext;
import cmdtree.cli.command.CommandNode;
import cmdtree.cli.command.Invocation;
import cmdtree.cli.option.ArgumentKind;
import cmdtree.cli.option.OptionDefinition;
import cmdtree.cli.option.OptionParser;

public class ImageCommand extends CommandNode {
    public static final String DEFAULT_REGISTRY = "registry.local:5000";

    public ImageCommand(final CommandContext context) {
        super(context, OptionParser.builder()
            .definition(OptionDefinition.of("--registry", "-r", "Registry to talk to (default is " + DEFAULT_REGISTRY + ").", ArgumentKind.STRING))
            .build());
    }

    @Override
    public String description() {
        return "Manages images.";
    }

    public static String registry(final Invocation invocation) {
        return invocation.parent()
            .filter(parent -> parent.command() instanceof ImageCommand)
            .flatMap(parent -> parent.value("registry"))
            .orElse(DEFAULT_REGISTRY);
    }
}
