package cmdtree.cli.command;

import cmdtree.Const;
import cmdtree.cli.ParseError;
import cmdtree.cli.RequirementViolationError;
import cmdtree.cli.help.HelpRenderer;
import cmdtree.cli.option.OptionParser;
import cmdtree.common.ErrorFactory;
import cmdtree.io.IoService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

@Slf4j
public abstract class CommandNode {
    private final CommandDescriptor descriptor;

    private final CommandRegistry registry;

    private final IoService ioService;

    private final OptionParser optionParser;

    protected CommandNode(final CommandContext context) {
        this(context, OptionParser.none());
    }

    protected CommandNode(final CommandContext context, final OptionParser optionParser) {
        descriptor = context.descriptor();
        registry = context.registry();
        ioService = context.ioService();
        this.optionParser = optionParser;
    }

    public abstract String description();

    public String name() {
        return descriptor.name();
    }

    public CommandDescriptor descriptor() {
        return descriptor;
    }

    public OptionParser optionParser() {
        return optionParser;
    }

    public boolean hasOptions() {
        return optionParser.hasOptions();
    }

    public boolean hasRequiredOptions() {
        return hasOptions() && optionParser.required();
    }

    public boolean hasSubCommands() {
        return !registry.childrenOf(descriptor).isEmpty();
    }

    public boolean isRootCommand() {
        return registry.parentOf(descriptor).isEmpty();
    }

    public boolean printHelpWithNoArgs() {
        return true;
    }

    public String commandArgsHelpString() {
        return hasSubCommands() ? Const.COMMAND_PLACEHOLDER : "";
    }

    public List<CommandNode> subCommands() {
        return registry.childrenOf(descriptor).stream().map(registry::resolve).collect(Collectors.toList());
    }

    public List<CommandNode> commandPath() {
        final List<CommandNode> path = new ArrayList<>();
        path.add(this);
        var parent = registry.parentOf(descriptor);
        while (parent.isPresent()) {
            path.add(registry.resolve(parent.get()));
            parent = registry.parentOf(parent.get());
        }
        Collections.reverse(path);
        return path;
    }

    public String commandPathNames() {
        return commandPath().stream().map(CommandNode::name).collect(Collectors.joining(" "));
    }

    public CompletableFuture<Void> runAsync(final String... args) throws ParseError {
        return runAsync(Arrays.asList(args));
    }

    public CompletableFuture<Void> runAsync(final List<String> args) throws ParseError {
        return runAsync(null, args);
    }

    public void printHelp() {
        ioService.write(HelpRenderer.render(this));
    }

    /**
     * Action of a leaf command. Commands with sub-commands never reach it.
     */
    protected CompletableFuture<Void> executeAsync(final Invocation invocation) throws ParseError {
        throw new IllegalStateException(commandPathNames() + " has no action to execute");
    }

    protected final CompletableFuture<Void> executeSubCommandAsync(final Invocation invocation) throws ParseError {
        final var commandArgs = invocation.arguments();
        if (commandArgs.isEmpty()) {
            throw ErrorFactory.commandNameRequired(commandPathNames());
        }

        final var subCommandName = commandArgs.get(0);
        final var selected = registry.childrenOf(descriptor).stream()
            .filter(child -> child.name().equals(subCommandName))
            .findFirst()
            .orElseThrow(() -> ErrorFactory.notAValidCommand(commandPathNames(), subCommandName));

        log.debug("dispatching {} to {}", commandPathNames(), subCommandName);
        return registry.resolve(selected).runAsync(invocation, commandArgs.subList(1, commandArgs.size()));
    }

    protected IoService ioService() {
        return ioService;
    }

    protected CommandRegistry registry() {
        return registry;
    }

    private CompletableFuture<Void> runAsync(final Invocation parent, final List<String> args) throws ParseError {
        if (printsHelp(args)) {
            printHelp();
            return CompletableFuture.completedFuture(null);
        }

        final var parsed = optionParser.parse(args);
        final var errors = optionParser.validate(parsed.options());
        if (!errors.isEmpty()) {
            throw new RequirementViolationError(errors);
        }

        final var invocation = new Invocation(this, parent, parsed.options(), parsed.remaining());
        if (hasSubCommands()) {
            return executeSubCommandAsync(invocation);
        }

        log.debug("executing {} with {}", commandPathNames(), invocation);
        return executeAsync(invocation);
    }

    private boolean printsHelp(final List<String> args) {
        if (args.isEmpty()) {
            return printHelpWithNoArgs();
        }
        return args.size() == 1 && (Const.HELP_SHORT.equals(args.get(0)) || Const.HELP_LONG.equals(args.get(0)));
    }
}
