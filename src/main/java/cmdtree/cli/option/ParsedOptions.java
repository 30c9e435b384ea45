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
public final class ParsedOptions {
    private final int consumed;

    private final List<ParsedOption> options;

    private final List<String> remaining;

    public ParsedOptions(final int consumed, final List<ParsedOption> options, final List<String> remaining) {
        this.consumed = consumed;
        this.options = List.copyOf(options);
        this.remaining = List.copyOf(remaining);
    }

    public Optional<ParsedOption> find(final String name) {
        return options.stream().filter(parsed -> parsed.isNamed(name)).findFirst();
    }

    public boolean isPresent(final String name) {
        return find(name).isPresent();
    }
}
