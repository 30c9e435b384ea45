package cmdtree.cli.command;

import cmdtree.Const;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Locale;
import java.util.Objects;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(of = {"namespace", "identity"})
@ToString(of = {"namespace", "identity"})
public final class CommandDescriptor {
    private final String namespace;

    private final String identity;

    private final CommandFactory factory;

    public CommandDescriptor(final String namespace, final String identity, final CommandFactory factory) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public static CommandDescriptor of(final Class<? extends CommandNode> type, final CommandFactory factory) {
        return new CommandDescriptor(type.getPackageName(), type.getSimpleName(), factory);
    }

    public static String nameOf(final String identity) {
        final var stripped = identity.endsWith(Const.COMMAND_SUFFIX) && identity.length() > Const.COMMAND_SUFFIX.length()
            ? identity.substring(0, identity.length() - Const.COMMAND_SUFFIX.length())
            : identity;
        return stripped.toLowerCase(Locale.ROOT);
    }

    public String name() {
        return nameOf(identity);
    }

    public String childNamespace() {
        return namespace.isEmpty() ? name() : namespace + Const.NAMESPACE_SEPARATOR + name();
    }
}
