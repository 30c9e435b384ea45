package cmdtree.cli.requirement;

import cmdtree.cli.option.OptionDefinition;
import cmdtree.cli.option.ParsedOption;
import cmdtree.common.ErrorFactory;
import io.vavr.control.Try;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public interface OptionRequirements {
    String MUTUALLY_EXCLUSIVE = "%s are mutually exclusive.";
    String IS_REQUIRED = "%s is required.";
    String AT_LEAST_ONE_REQUIRED = "%s at least one is required.";
    String IF_PRESENT_THEN = "If %s is present then %s";
    String IN_RANGE = "%s has value in range [%s, %s].";
    String INVALID_VALUE = "Invalid argument value: %s %s";

    static List<OptionRequirementError> validate(
        final List<OptionDefinition> definitions,
        final List<OptionRequirement> requirements,
        final List<ParsedOption> parsedOptions) {
        return requirements.stream()
            .flatMap(requirement -> validate(definitions, requirement, parsedOptions).stream())
            .collect(Collectors.toList());
    }

    static List<OptionRequirementError> validate(
        final List<OptionDefinition> definitions,
        final OptionRequirement requirement,
        final List<ParsedOption> parsedOptions) {
        switch (requirement.kind()) {
            case EXCLUSIVE:
                return exclusive(requirement, parsedOptions);
            case REQUIRE_ONE_OF:
                return requireOneOf(definitions, requirement, parsedOptions);
            case IF_PRESENT_THEN:
                return ifPresentThen(definitions, (OptionRequirement.IfPresentThen) requirement, parsedOptions);
            case RANGE:
                return range(definitions, (OptionRequirement.Range) requirement, parsedOptions);
            default:
                throw new IllegalStateException("Unknown requirement kind: " + requirement.kind());
        }
    }

    static String helpLine(final List<OptionDefinition> definitions, final OptionRequirement requirement) {
        switch (requirement.kind()) {
            case EXCLUSIVE:
                return String.format(MUTUALLY_EXCLUSIVE, longNames(definitions, requirement));
            case REQUIRE_ONE_OF:
                return requiredSentence(definitions, requirement);
            case IF_PRESENT_THEN:
                final var ifPresentThen = (OptionRequirement.IfPresentThen) requirement;
                return String.format(IF_PRESENT_THEN,
                    findDefinition(definitions, ifPresentThen.optionName()).longName(),
                    helpLine(definitions, ifPresentThen.then()));
            case RANGE:
                final var range = (OptionRequirement.Range) requirement;
                return rangeSentence(findDefinition(definitions, range.optionName()), range);
            default:
                throw new IllegalStateException("Unknown requirement kind: " + requirement.kind());
        }
    }

    static void checkReferences(final List<OptionDefinition> definitions, final List<OptionRequirement> requirements) {
        for (final var requirement : requirements) {
            for (final var name : requirement.optionNames()) {
                final var definition = findDefinition(definitions, name);
                if (requirement.kind() == OptionRequirement.Kind.RANGE && definition.isFlag()) {
                    throw ErrorFactory.rangeOverFlag(definition.longName());
                }
            }
            if (requirement.kind() == OptionRequirement.Kind.IF_PRESENT_THEN) {
                checkReferences(definitions, List.of(((OptionRequirement.IfPresentThen) requirement).then()));
            }
        }
    }

    static OptionDefinition findDefinition(final List<OptionDefinition> definitions, final String name) {
        return definitions.stream()
            .filter(definition -> definition.isNamed(name))
            .findFirst()
            .orElseThrow(() -> ErrorFactory.undeclaredOption(name));
    }

    static Optional<ParsedOption> findParsedOption(final List<ParsedOption> parsedOptions, final String name) {
        return parsedOptions.stream().filter(parsed -> parsed.isNamed(name)).findFirst();
    }

    static String formatBound(final double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Plain decimal notation only, surrounding blanks allowed. Type suffixes and hex are rejected.
     */
    static double parseNumber(final String literal) {
        return new BigDecimal(literal.trim()).doubleValue();
    }

    private static List<OptionRequirementError> exclusive(
        final OptionRequirement requirement,
        final List<ParsedOption> parsedOptions) {
        final var present = parsedOptions.stream()
            .filter(parsed -> requirement.optionNames().stream().anyMatch(parsed::isNamed))
            .map(ParsedOption::parsedName)
            .collect(Collectors.toList());

        if (present.size() < 2) {
            return List.of();
        }
        return List.of(new OptionRequirementError(String.format(MUTUALLY_EXCLUSIVE, String.join(", ", present))));
    }

    private static List<OptionRequirementError> requireOneOf(
        final List<OptionDefinition> definitions,
        final OptionRequirement requirement,
        final List<ParsedOption> parsedOptions) {
        final var anyPresent = requirement.optionNames().stream()
            .anyMatch(name -> findParsedOption(parsedOptions, name).isPresent());

        return anyPresent ? List.of() : List.of(new OptionRequirementError(requiredSentence(definitions, requirement)));
    }

    private static List<OptionRequirementError> ifPresentThen(
        final List<OptionDefinition> definitions,
        final OptionRequirement.IfPresentThen requirement,
        final List<ParsedOption> parsedOptions) {
        if (findParsedOption(parsedOptions, requirement.optionName()).isEmpty()) {
            return List.of();
        }

        final var trigger = findDefinition(definitions, requirement.optionName()).longName();
        return validate(definitions, requirement.then(), parsedOptions).stream()
            .map(error -> new OptionRequirementError(String.format(IF_PRESENT_THEN, trigger, error.message())))
            .collect(Collectors.toList());
    }

    private static List<OptionRequirementError> range(
        final List<OptionDefinition> definitions,
        final OptionRequirement.Range requirement,
        final List<ParsedOption> parsedOptions) {
        final var found = findParsedOption(parsedOptions, requirement.optionName());
        if (found.isEmpty()) {
            return List.of();
        }

        final var parsed = found.get();
        final var literal = parsed.firstArg()
            .orElseThrow(() -> ErrorFactory.rangeOverFlag(parsed.option().longName()));
        final var value = Try.of(() -> parseNumber(literal));

        if (value.isFailure()) {
            return List.of(new OptionRequirementError(String.format(INVALID_VALUE, parsed.parsedName(), literal)));
        }
        if (requirement.contains(value.get())) {
            return List.of();
        }
        return List.of(new OptionRequirementError(rangeSentence(findDefinition(definitions, requirement.optionName()), requirement)));
    }

    private static String requiredSentence(final List<OptionDefinition> definitions, final OptionRequirement requirement) {
        return String.format(
            requirement.optionNames().size() == 1 ? IS_REQUIRED : AT_LEAST_ONE_REQUIRED,
            longNames(definitions, requirement));
    }

    private static String rangeSentence(final OptionDefinition definition, final OptionRequirement.Range range) {
        return String.format(IN_RANGE, definition.longName(), formatBound(range.minValue()), formatBound(range.maxValue()));
    }

    private static String longNames(final List<OptionDefinition> definitions, final OptionRequirement requirement) {
        return requirement.optionNames().stream()
            .map(name -> findDefinition(definitions, name).longName())
            .collect(Collectors.joining(", "));
    }
}
