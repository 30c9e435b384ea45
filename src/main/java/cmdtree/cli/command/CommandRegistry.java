package cmdtree.cli.command;

import java.util.List;
import java.util.Optional;

public interface CommandRegistry {
    CommandDescriptor root();

    /**
     * Children ordered by name.
     */
    List<CommandDescriptor> childrenOf(CommandDescriptor parent);

    Optional<CommandDescriptor> parentOf(CommandDescriptor child);

    /**
     * Returns the command for a registered descriptor, building it on first use.
     */
    CommandNode resolve(CommandDescriptor descriptor);

    default CommandNode rootCommand() {
        return resolve(root());
    }
}
