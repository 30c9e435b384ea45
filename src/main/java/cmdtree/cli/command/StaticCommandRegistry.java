package cmdtree.cli.command;

import cmdtree.Const;
import cmdtree.common.ErrorFactory;
import cmdtree.io.IoService;
import lombok.Builder;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
public final class StaticCommandRegistry implements CommandRegistry {
    private final List<CommandDescriptor> commands;

    private final IoService ioService;

    private final Map<CommandDescriptor, CommandNode> instances = new HashMap<>();

    @Builder
    private StaticCommandRegistry(@Singular final List<CommandDescriptor> commands, final IoService ioService) {
        this.commands = List.copyOf(commands);
        this.ioService = ioService;

        final var seen = new HashSet<List<String>>();
        for (final var command : this.commands) {
            if (!seen.add(List.of(command.namespace(), command.name()))) {
                throw ErrorFactory.duplicateCommand(command.name(), command.namespace());
            }
        }
        log.info("registered {} command(s)", this.commands.size());
    }

    public static class StaticCommandRegistryBuilder {
        public StaticCommandRegistryBuilder register(final Class<? extends CommandNode> type, final CommandFactory factory) {
            return command(CommandDescriptor.of(type, factory));
        }

        public StaticCommandRegistryBuilder register(final String namespace, final String identity, final CommandFactory factory) {
            return command(new CommandDescriptor(namespace, identity, factory));
        }
    }

    @Override
    public CommandDescriptor root() {
        final var roots = commands.stream()
            .filter(command -> parentOf(command).isEmpty())
            .collect(Collectors.toList());

        if (roots.isEmpty()) {
            throw ErrorFactory.noRootCommand();
        }
        if (roots.size() > 1) {
            throw ErrorFactory.ambiguousRootCommand(roots.stream().map(CommandDescriptor::name).collect(Collectors.joining(", ")));
        }
        return roots.get(0);
    }

    @Override
    public List<CommandDescriptor> childrenOf(final CommandDescriptor parent) {
        final var namespace = parent.childNamespace();
        return commands.stream()
            .filter(command -> command.namespace().equals(namespace))
            .sorted(Comparator.comparing(CommandDescriptor::name))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<CommandDescriptor> parentOf(final CommandDescriptor child) {
        final var namespace = child.namespace();
        if (namespace.isEmpty()) {
            return Optional.empty();
        }

        final var separator = namespace.lastIndexOf(Const.NAMESPACE_SEPARATOR);
        final var parentNamespace = separator < 0 ? "" : namespace.substring(0, separator);
        final var ownerName = namespace.substring(separator + 1);

        return commands.stream()
            .filter(command -> command.namespace().equals(parentNamespace) && command.name().equals(ownerName))
            .findFirst();
    }

    @Override
    public CommandNode resolve(final CommandDescriptor descriptor) {
        final var cached = instances.get(descriptor);
        if (cached != null) {
            return cached;
        }

        final var registered = commands.stream()
            .filter(command -> command.equals(descriptor))
            .findFirst()
            .orElseThrow(() -> ErrorFactory.unknownDescriptor(descriptor.toString()));

        log.debug("creating command {}", registered);
        final var created = registered.factory().create(new CommandContext(registered, this, ioService));
        instances.put(registered, created);
        return created;
    }
}
