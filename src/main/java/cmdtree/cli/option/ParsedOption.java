package cmdtree.cli.option;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Optional;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class ParsedOption {
    private final OptionDefinition option;

    private final String parsedName;

    private final List<String> parsedArgs;

    public ParsedOption(final OptionDefinition option, final String parsedName, final List<String> parsedArgs) {
        this.option = option;
        this.parsedName = parsedName;
        this.parsedArgs = List.copyOf(parsedArgs);
    }

    public ParsedOption(final OptionDefinition option, final String parsedName, final String... parsedArgs) {
        this(option, parsedName, List.of(parsedArgs));
    }

    public Optional<String> firstArg() {
        return parsedArgs.isEmpty() ? Optional.empty() : Optional.of(parsedArgs.get(0));
    }

    public boolean isNamed(final String name) {
        return option.isNamed(name);
    }
}
