package cmdtree.sample.imagectl.image;

import cmdtree.cli.ParseError;
import cmdtree.cli.command.CommandContext;
import cmdtree.cli.command.CommandNode;
import cmdtree.cli.command.Invocation;
import cmdtree.cli.option.ArgumentKind;
import cmdtree.cli.option.OptionDefinition;
import cmdtree.cli.option.OptionParser;
import cmdtree.cli.requirement.OptionRequirement;
import cmdtree.sample.imagectl.ImageCommand;

import java.util.concurrent.CompletableFuture;

public class PushCommand extends CommandNode {
    public PushCommand(final CommandContext context) {
        super(context, OptionParser.builder()
            .definition(OptionDefinition.of("--tag", "-t", "Tag to push.", ArgumentKind.STRING))
            .definition(OptionDefinition.flag("--sign", "-s", "Signs the image before pushing it."))
            .definition(OptionDefinition.of("--key", "-k", "Signing key file.", ArgumentKind.PATH))
            .definition(OptionDefinition.of("--compress-level", "-c", "Layer compression level.", ArgumentKind.INT))
            .requirement(OptionRequirement.requireOneOf("tag"))
            .requirement(OptionRequirement.ifPresentThen("sign", OptionRequirement.requireOneOf("key")))
            .requirement(OptionRequirement.range("compress-level", 1, 9))
            .build());
    }

    @Override
    public String description() {
        return "Pushes a local image to the registry.";
    }

    @Override
    public String commandArgsHelpString() {
        return "REPOSITORY";
    }

    @Override
    protected CompletableFuture<Void> executeAsync(final Invocation invocation) throws ParseError {
        if (invocation.arguments().size() != 1) {
            throw new ParseError(commandPathNames() + ": exactly one REPOSITORY is required.");
        }

        final var reference = invocation.arguments().get(0) + ":" + invocation.value("tag").orElseThrow();
        final var level = invocation.intValue("compress-level").orElse(6);

        ioService().writeLine("Pushing " + reference + " to " + ImageCommand.registry(invocation) + " (compression " + level + ")");
        invocation.value("key").ifPresent(key -> ioService().writeLine("Signed with " + key));
        return CompletableFuture.completedFuture(null);
    }
}
