package cmdtree.common;

import cmdtree.cli.ConfigurationError;
import cmdtree.cli.ParseError;
import cmdtree.cli.UnknownCommandError;

import java.util.List;

public interface ErrorFactory {
    String NOT_A_VALID_COMMAND = "%s: '%s' is not a valid command.";

    String COMMAND_NAME_REQUIRED = "%s: a command name is required.";

    String TRUNCATED_OPTION = "No valid argument was found following the %s option, expected: %s";

    String DUPLICATE_OPTION = "%s was specified more than once (%s, %s).";

    String UNDECLARED_OPTION = "Option '%s' is not declared by this command.";

    String DUPLICATE_OPTION_DEFINITION = "Option name '%s' is declared more than once.";

    String AMBIGUOUS_OPTION_NAME = "Option name '%s' would refer to both %s and %s.";

    String INVALID_RANGE = "Min value must be smaller than max value, but received [%s, %s].";

    String RANGE_OVER_FLAG = "Option %s takes no argument and can't have a range requirement.";

    String DUPLICATE_COMMAND = "Command '%s' is registered more than once in namespace '%s'.";

    String UNKNOWN_DESCRIPTOR = "Command '%s' is not registered.";

    String NO_ROOT_COMMAND = "No root command is registered.";

    String AMBIGUOUS_ROOT_COMMAND = "More than one root command is registered: %s.";

    static UnknownCommandError notAValidCommand(final String commandPath, final String attempted) {
        return new UnknownCommandError(String.format(NOT_A_VALID_COMMAND, commandPath, attempted), commandPath, attempted);
    }

    static UnknownCommandError commandNameRequired(final String commandPath) {
        return new UnknownCommandError(String.format(COMMAND_NAME_REQUIRED, commandPath), commandPath, null);
    }

    static ParseError truncatedOption(final String token, final List<String> placeholders) {
        return new ParseError(String.format(TRUNCATED_OPTION, token, String.join(" ", placeholders)));
    }

    static ParseError duplicateOption(final String longName, final String first, final String second) {
        return new ParseError(String.format(DUPLICATE_OPTION, longName, first, second));
    }

    static RuntimeException undeclaredOption(final String name) {
        return new ConfigurationError(String.format(UNDECLARED_OPTION, name));
    }

    static RuntimeException duplicateOptionDefinition(final String name) {
        return new ConfigurationError(String.format(DUPLICATE_OPTION_DEFINITION, name));
    }

    static RuntimeException ambiguousOptionName(final String bareName, final String first, final String second) {
        return new ConfigurationError(String.format(AMBIGUOUS_OPTION_NAME, bareName, first, second));
    }

    static RuntimeException invalidRange(final String min, final String max) {
        return new ConfigurationError(String.format(INVALID_RANGE, min, max));
    }

    static RuntimeException rangeOverFlag(final String longName) {
        return new ConfigurationError(String.format(RANGE_OVER_FLAG, longName));
    }

    static RuntimeException duplicateCommand(final String name, final String namespace) {
        return new ConfigurationError(String.format(DUPLICATE_COMMAND, name, namespace));
    }

    static RuntimeException unknownDescriptor(final String name) {
        return new ConfigurationError(String.format(UNKNOWN_DESCRIPTOR, name));
    }

    static RuntimeException noRootCommand() {
        return new ConfigurationError(NO_ROOT_COMMAND);
    }

    static RuntimeException ambiguousRootCommand(final String names) {
        return new ConfigurationError(String.format(AMBIGUOUS_ROOT_COMMAND, names));
    }
}
