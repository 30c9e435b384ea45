package cmdtree.sample;

import cmdtree.cli.command.CommandContext;
import cmdtree.cli.command.CommandNode;
import cmdtree.cli.option.OptionDefinition;
import cmdtree.cli.option.OptionParser;

public class ImagectlCommand extends CommandNode {
    public ImagectlCommand(final CommandContext context) {
        super(context, OptionParser.builder()
            .definition(OptionDefinition.flag("--verbose", "-v", "Prints what every command does in detail."))
            .build());
    }

    @Override
    public String description() {
        return "imagectl moves container images between a registry and the local store.";
    }
}
