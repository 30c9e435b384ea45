package cmdtree.cli.command;

import cmdtree.io.IoService;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

@AllArgsConstructor
@Getter
@Accessors(fluent = true)
public final class CommandContext {
    private final CommandDescriptor descriptor;

    private final CommandRegistry registry;

    private final IoService ioService;
}
