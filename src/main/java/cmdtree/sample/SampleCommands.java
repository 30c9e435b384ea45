package cmdtree.sample;

import cmdtree.cli.command.CommandRegistry;
import cmdtree.cli.command.Invocation;
import cmdtree.cli.command.StaticCommandRegistry;
import cmdtree.io.IoService;
import cmdtree.sample.imagectl.ImageCommand;
import cmdtree.sample.imagectl.VersionCommand;
import cmdtree.sample.imagectl.image.PullCommand;
import cmdtree.sample.imagectl.image.PushCommand;

public interface SampleCommands {
    static CommandRegistry registry(final IoService ioService) {
        return StaticCommandRegistry.builder()
            .ioService(ioService)
            .register(ImagectlCommand.class, ImagectlCommand::new)
            .register(ImageCommand.class, ImageCommand::new)
            .register(VersionCommand.class, VersionCommand::new)
            .register(PullCommand.class, PullCommand::new)
            .register(PushCommand.class, PushCommand::new)
            .build();
    }

    static boolean verbose(final Invocation invocation) {
        var current = invocation;
        while (current.parent().isPresent()) {
            current = current.parent().get();
        }
        return current.command() instanceof ImagectlCommand && current.isPresent("verbose");
    }
}
