package cmdtree.cli.command;

import cmdtree.cli.ParseError;
import cmdtree.cli.option.ParsedOption;
import cmdtree.cli.requirement.OptionRequirements;
import io.vavr.control.Try;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString(exclude = "command")
public final class Invocation {
    @EqualsAndHashCode.Exclude
    private final CommandNode command;

    @Getter(AccessLevel.NONE)
    private final Invocation parent;

    private final List<ParsedOption> options;

    private final List<String> arguments;

    public Invocation(
        final CommandNode command,
        final Invocation parent,
        final List<ParsedOption> options,
        final List<String> arguments) {
        this.command = command;
        this.parent = parent;
        this.options = List.copyOf(options);
        this.arguments = List.copyOf(arguments);
    }

    public Optional<Invocation> parent() {
        return Optional.ofNullable(parent);
    }

    public Optional<ParsedOption> option(final String name) {
        command.optionParser().definition(name);
        return OptionRequirements.findParsedOption(options, name);
    }

    public boolean isPresent(final String name) {
        return option(name).isPresent();
    }

    public Optional<String> value(final String name) {
        return option(name).flatMap(ParsedOption::firstArg);
    }

    public List<String> values(final String name) {
        return option(name).map(ParsedOption::parsedArgs).orElse(List.of());
    }

    public Optional<Integer> intValue(final String name) throws ParseError {
        return coerce(name, literal -> Integer.parseInt(literal.trim()));
    }

    public Optional<Double> doubleValue(final String name) throws ParseError {
        return coerce(name, OptionRequirements::parseNumber);
    }

    private <T> Optional<T> coerce(final String name, final Function<String, T> converter) throws ParseError {
        final var found = option(name);
        if (found.isEmpty() || found.get().firstArg().isEmpty()) {
            return Optional.empty();
        }

        final var parsed = found.get();
        final var literal = parsed.firstArg().get();
        final var value = Try.of(() -> converter.apply(literal));
        if (value.isFailure()) {
            throw new ParseError(String.format(OptionRequirements.INVALID_VALUE, parsed.parsedName(), literal), value.getCause());
        }
        return Optional.of(value.get());
    }
}
