package cmdtree.cli;

public class ConfigurationError extends IllegalArgumentException {
    public ConfigurationError(final String message) {
        super(message);
    }
}
