package cmdtree.cli.option;

import cmdtree.cli.ParseError;
import cmdtree.cli.requirement.OptionRequirement;
import cmdtree.cli.requirement.OptionRequirementError;
import cmdtree.cli.requirement.OptionRequirements;
import cmdtree.common.ErrorFactory;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

@Slf4j
@Getter
@Accessors(fluent = true)
public final class OptionParser {
    private static final OptionParser NONE = OptionParser.builder().build();

    private final List<OptionDefinition> definitions;

    private final List<OptionRequirement> requirements;

    private final boolean required;

    @Builder
    private OptionParser(
        @Singular final List<OptionDefinition> definitions,
        @Singular final List<OptionRequirement> requirements,
        final Boolean required) {
        this.definitions = List.copyOf(definitions);
        this.requirements = List.copyOf(requirements);
        this.required = required != null ? required : requirements.stream()
            .anyMatch(requirement -> requirement.kind() == OptionRequirement.Kind.REQUIRE_ONE_OF);

        checkUniqueNames(this.definitions);
        OptionRequirements.checkReferences(this.definitions, this.requirements);
    }

    public static OptionParser none() {
        return NONE;
    }

    public boolean hasOptions() {
        return !definitions.isEmpty();
    }

    public Optional<OptionDefinition> definitionForToken(final String token) {
        return definitions.stream().filter(definition -> definition.matchesToken(token)).findFirst();
    }

    public OptionDefinition definition(final String name) {
        return OptionRequirements.findDefinition(definitions, name);
    }

    public ParsedOptions parse(final List<String> args) throws ParseError {
        final List<ParsedOption> parsed = new ArrayList<>();

        var i = 0;
        while (i < args.size()) {
            final var token = args.get(i);
            final var definition = definitionForToken(token);
            if (definition.isEmpty()) {
                break;
            }

            final var option = definition.get();
            if (i + option.arity() >= args.size()) {
                throw ErrorFactory.truncatedOption(token, option.placeholders());
            }

            for (final var previous : parsed) {
                if (previous.option().equals(option)) {
                    throw ErrorFactory.duplicateOption(option.longName(), previous.parsedName(), token);
                }
            }

            parsed.add(new ParsedOption(option, token, args.subList(i + 1, i + 1 + option.arity())));
            i += 1 + option.arity();
        }

        log.debug("parsed {} option token(s): {}", i, parsed);
        return new ParsedOptions(i, parsed, args.subList(i, args.size()));
    }

    public List<OptionRequirementError> validate(final List<ParsedOption> parsedOptions) {
        return OptionRequirements.validate(definitions, requirements, parsedOptions);
    }

    private static void checkUniqueNames(final List<OptionDefinition> definitions) {
        final var names = new HashSet<String>();
        final var owners = new HashMap<String, OptionDefinition>();
        for (final var definition : definitions) {
            for (final var name : definition.names()) {
                if (!names.add(name)) {
                    throw ErrorFactory.duplicateOptionDefinition(name);
                }
                // rules and lookups may drop the dashes, so "--v" and "-v" can't belong to two options
                final var owner = owners.putIfAbsent(OptionDefinition.bareName(name), definition);
                if (owner != null && owner != definition) {
                    throw ErrorFactory.ambiguousOptionName(OptionDefinition.bareName(name), owner.longName(), name);
                }
            }
        }
    }
}
