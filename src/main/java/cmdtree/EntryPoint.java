package cmdtree;

import cmdtree.cli.ParseError;
import cmdtree.io.ConsoleIoService;
import cmdtree.io.IoService;
import cmdtree.sample.SampleCommands;
import io.vavr.control.Try;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletionException;

@Slf4j
public class EntryPoint {

    public static void main(final String[] args) {
        System.exit(run(new ConsoleIoService(), args));
    }

    public static int run(final IoService ioService, final String... args) {
        final var root = SampleCommands.registry(ioService).rootCommand();

        return Try.of(() -> root.runAsync(args).join())
            .map(nothing -> Const.ExitCodes.OK)
            .recover(ParseError.class, failure -> {
                ioService.writeErrorLine(failure.getMessage());
                ioService.writeErrorLine(String.format("Run '%s %s' for usage.", root.name(), Const.HELP_LONG));
                return Const.ExitCodes.USAGE;
            })
            .recover(CompletionException.class, failure -> {
                final var cause = failure.getCause() != null ? failure.getCause() : failure;
                log.debug("command failed", cause);
                ioService.writeErrorLine(cause.getClass().getSimpleName() + ": " + cause.getMessage());
                return Const.ExitCodes.FAILURE;
            })
            .getOrElseGet(failure -> {
                log.error("unexpected failure", failure);
                ioService.writeErrorLine(failure.getMessage());
                return Const.ExitCodes.FAILURE;
            });
    }
}
