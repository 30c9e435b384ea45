package cmdtree.cli.help;

import cmdtree.Const;
import cmdtree.cli.command.CommandNode;
import cmdtree.cli.option.OptionDefinition;
import cmdtree.cli.requirement.OptionRequirements;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Locale;

@AllArgsConstructor
public final class HelpRenderer {
    private static final HelpRenderer DEFAULT = new HelpRenderer(Configuration.builder().build());

    private final Configuration configuration;

    @Getter
    @Accessors(fluent = true)
    @Builder
    public static final class Configuration {
        @Builder.Default
        private final int indent = 2;

        @Builder.Default
        private final int columnGap = 4;
    }

    public static String render(final CommandNode command) {
        return DEFAULT.text(command);
    }

    public String text(final CommandNode command) {
        final var sb = new StringBuilder();
        final var pathNames = command.commandPathNames();

        sb.append(pathNames).append("\n");
        sb.append(command.description()).append("\n");
        sb.append("\n");

        sb.append("Usage:  ").append(usage(command)).append("\n");
        sb.append("\n");

        appendCommands(sb, command);
        appendOptions(sb, command);
        appendRequirements(sb, command);

        sb.append(String.format("Run '%1$s %2$s' or '%1$s %3$s' to print help.", pathNames, Const.HELP_SHORT, Const.HELP_LONG))
            .append("\n");
        if (command.isRootCommand()) {
            sb.append(String.format(
                "Run '%1$s %2$s %3$s' or '%1$s %2$s %4$s' for more information on a command.",
                pathNames, Const.COMMAND_PLACEHOLDER, Const.HELP_SHORT, Const.HELP_LONG)).append("\n");
        }
        sb.append("\n");

        return sb.toString();
    }

    public String usage(final CommandNode command) {
        final var sb = new StringBuilder();
        for (final var node : command.commandPath()) {
            sb.append(node.name());
            if (node.hasOptions()) {
                final var placeholder = node.name().toUpperCase(Locale.ROOT) + Const.OPTIONS_PLACEHOLDER_SUFFIX;
                sb.append(" ").append(node.hasRequiredOptions() ? placeholder : "[" + placeholder + "]");
            }
            sb.append(" ");
        }
        sb.append(command.commandArgsHelpString());
        return sb.toString().stripTrailing();
    }

    private void appendCommands(final StringBuilder sb, final CommandNode command) {
        final var subCommands = command.subCommands();
        if (subCommands.isEmpty()) {
            return;
        }

        sb.append("Commands:\n");
        final var width = subCommands.stream().mapToInt(subCommand -> subCommand.name().length()).max().orElse(0)
            + configuration.columnGap();
        for (final var subCommand : subCommands) {
            sb.append(spaces(configuration.indent()))
                .append(pad(subCommand.name(), width))
                .append(subCommand.description())
                .append("\n");
        }
        sb.append("\n");
    }

    private void appendOptions(final StringBuilder sb, final CommandNode command) {
        final var definitions = command.optionParser().definitions();
        if (definitions.isEmpty()) {
            return;
        }

        sb.append("Options:\n");
        final var width = definitions.stream().mapToInt(definition -> definition.label().length()).max().orElse(0)
            + configuration.columnGap();
        for (final var definition : definitions) {
            sb.append(spaces(configuration.indent()))
                .append(shortNameColumn(definition))
                .append(pad(definition.label(), width))
                .append(definition.description())
                .append("\n");
        }
        sb.append("\n");
    }

    private void appendRequirements(final StringBuilder sb, final CommandNode command) {
        final var parser = command.optionParser();
        if (parser.requirements().isEmpty()) {
            return;
        }

        sb.append("Option requirements:\n");
        for (final var requirement : parser.requirements()) {
            sb.append(spaces(configuration.indent()))
                .append(OptionRequirements.helpLine(parser.definitions(), requirement))
                .append("\n");
        }
        sb.append("\n");
    }

    private static String shortNameColumn(final OptionDefinition definition) {
        return definition.shortName() == null ? "    " : definition.shortName() + ", ";
    }

    private static String pad(final String text, final int width) {
        return text + spaces(width - text.length());
    }

    private static String spaces(final int count) {
        return " ".repeat(Math.max(0, count));
    }
}
