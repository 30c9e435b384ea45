package cmdtree.cli;

import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
public class UnknownCommandError extends ParseError {
    private final String commandPath;

    private final String attempted;

    public UnknownCommandError(final String message, final String commandPath, final String attempted) {
        super(message);
        this.commandPath = commandPath;
        this.attempted = attempted;
    }
}
