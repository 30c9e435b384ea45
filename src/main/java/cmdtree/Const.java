package cmdtree;

public interface Const {
    String HELP_SHORT = "-h";
    String HELP_LONG = "--help";
    String COMMAND_SUFFIX = "Command";
    String COMMAND_PLACEHOLDER = "COMMAND";
    String OPTIONS_PLACEHOLDER_SUFFIX = "_OPTIONS";
    String NAMESPACE_SEPARATOR = ".";
    String LONG_PREFIX = "--";
    String SHORT_PREFIX = "-";

    interface ExitCodes {
        int OK = 0;
        int USAGE = 1;
        int FAILURE = 2;
    }
}
