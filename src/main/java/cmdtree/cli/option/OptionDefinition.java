package cmdtree.cli.option;

import cmdtree.Const;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class OptionDefinition {
    private final String longName;

    private final String shortName;

    private final String description;

    private final List<ArgumentKind> argumentKinds;

    private OptionDefinition(
        final String longName,
        final String shortName,
        final String description,
        final List<ArgumentKind> argumentKinds) {
        this.longName = withPrefix(Objects.requireNonNull(longName, "longName"), Const.LONG_PREFIX);
        this.shortName = shortName == null ? null : withPrefix(shortName, Const.SHORT_PREFIX);
        this.description = Objects.requireNonNull(description, "description");
        this.argumentKinds = List.copyOf(argumentKinds);
    }

    public static OptionDefinition flag(final String longName, final String shortName, final String description) {
        return new OptionDefinition(longName, shortName, description, List.of());
    }

    public static OptionDefinition of(
        final String longName,
        final String shortName,
        final String description,
        final ArgumentKind... argumentKinds) {
        return new OptionDefinition(longName, shortName, description, Arrays.asList(argumentKinds));
    }

    public int arity() {
        return argumentKinds.size();
    }

    public boolean isFlag() {
        return argumentKinds.isEmpty();
    }

    public boolean matchesToken(final String token) {
        return token.equals(longName) || token.equals(shortName);
    }

    /**
     * True when a name used in code (with or without dashes) refers to this option.
     */
    public boolean isNamed(final String name) {
        return matchesToken(name)
            || matchesToken(Const.LONG_PREFIX + name)
            || matchesToken(Const.SHORT_PREFIX + name);
    }

    public List<String> names() {
        return shortName == null ? List.of(longName) : List.of(longName, shortName);
    }

    public static String bareName(final String name) {
        var i = 0;
        while (i < name.length() && name.charAt(i) == '-') {
            i++;
        }
        return name.substring(i);
    }

    public List<String> placeholders() {
        return argumentKinds.stream().map(ArgumentKind::placeholder).collect(Collectors.toList());
    }

    public String label() {
        return placeholders().stream().map(placeholder -> " " + placeholder).collect(Collectors.joining("", longName, ""));
    }

    private static String withPrefix(final String name, final String prefix) {
        return name.startsWith(Const.SHORT_PREFIX) ? name : prefix + name;
    }
}
