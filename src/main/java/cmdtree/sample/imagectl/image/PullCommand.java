package cmdtree.sample.imagectl.image;

import cmdtree.cli.ParseError;
import cmdtree.cli.command.CommandContext;
import cmdtree.cli.command.CommandNode;
import cmdtree.cli.command.Invocation;
import cmdtree.cli.option.ArgumentKind;
import cmdtree.cli.option.OptionDefinition;
import cmdtree.cli.option.OptionParser;
import cmdtree.cli.requirement.OptionRequirement;
import cmdtree.sample.SampleCommands;
import cmdtree.sample.imagectl.ImageCommand;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

@Slf4j
public class PullCommand extends CommandNode {
    public static final String DEFAULT_TAG = "latest";

    public PullCommand(final CommandContext context) {
        super(context, OptionParser.builder()
            .definition(OptionDefinition.of("--tag", "-t", "Tag to pull (default is " + DEFAULT_TAG + ").", ArgumentKind.STRING))
            .definition(OptionDefinition.flag("--all-tags", "-a", "Pulls every tag of the repository."))
            .definition(OptionDefinition.of("--retries", null, "Attempts before giving up.", ArgumentKind.INT))
            .definition(OptionDefinition.flag("--quiet", "-q", "Prints nothing but the pulled reference."))
            .requirement(OptionRequirement.exclusive("tag", "all-tags"))
            .requirement(OptionRequirement.range("retries", 0, 10))
            .build());
    }

    @Override
    public String description() {
        return "Pulls an image from the registry.";
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

        final var repository = invocation.arguments().get(0);
        final var reference = invocation.isPresent("all-tags")
            ? repository + " (all tags)"
            : repository + ":" + invocation.value("tag").orElse(DEFAULT_TAG);
        final var retries = invocation.intValue("retries").orElse(0);
        final var registry = ImageCommand.registry(invocation);
        final var quiet = invocation.isPresent("quiet");
        final var verbose = SampleCommands.verbose(invocation);

        return CompletableFuture.runAsync(() -> {
            log.debug("pulling {} from {} with {} retries", reference, registry, retries);
            if (quiet) {
                ioService().writeLine(reference);
                return;
            }
            ioService().writeLine("Pulling " + reference + " from " + registry);
            if (verbose) {
                ioService().writeLine("Retries allowed: " + retries);
            }
        });
    }
}
