package cmdtree.cli.requirement;

import cmdtree.cli.ConfigurationError;
import cmdtree.cli.option.ArgumentKind;
import cmdtree.cli.option.OptionDefinition;
import cmdtree.cli.option.ParsedOption;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static cmdtree.cli.requirement.OptionRequirement.exclusive;
import static cmdtree.cli.requirement.OptionRequirement.ifPresentThen;
import static cmdtree.cli.requirement.OptionRequirement.range;
import static cmdtree.cli.requirement.OptionRequirement.requireOneOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptionRequirementsTest {
    private static final OptionDefinition A = OptionDefinition.flag("--alpha", "-a", "Alpha.");
    private static final OptionDefinition B = OptionDefinition.flag("--beta", "-b", "Beta.");
    private static final OptionDefinition C = OptionDefinition.flag("--gamma", "-c", "Gamma.");
    private static final OptionDefinition KEY = OptionDefinition.of("--key", "-k", "Key.", ArgumentKind.PATH);
    private static final OptionDefinition LEVEL = OptionDefinition.of("--level", "-l", "Level.", ArgumentKind.INT);

    private static final List<OptionDefinition> DEFINITIONS = List.of(A, B, C, KEY, LEVEL);

    private static final ParsedOption PARSED_A = new ParsedOption(A, "-a");
    private static final ParsedOption PARSED_B = new ParsedOption(B, "--beta");
    private static final ParsedOption PARSED_C = new ParsedOption(C, "-c");

    private static List<String> messages(final OptionRequirement requirement, final ParsedOption... parsed) {
        return OptionRequirements.validate(DEFINITIONS, requirement, List.of(parsed)).stream()
            .map(OptionRequirementError::message)
            .collect(Collectors.toList());
    }

    private static ParsedOption level(final String literal) {
        return new ParsedOption(LEVEL, "--level", literal);
    }

    @ParameterizedTest
    @MethodSource("exclusiveProvider")
    void exclusiveReportsPresentNamesInEncounterOrder(final List<ParsedOption> parsed, final List<String> expected) {
        final var errors = OptionRequirements.validate(DEFINITIONS, exclusive("a", "b", "c"), parsed);

        assertThat(errors).extracting(OptionRequirementError::message).isEqualTo(expected);
    }

    static Stream<Arguments> exclusiveProvider() {
        return Stream.of(
            Arguments.of(List.of(), List.of()),
            Arguments.of(List.of(PARSED_A), List.of()),
            Arguments.of(List.of(PARSED_C), List.of()),
            Arguments.of(List.of(PARSED_A, PARSED_B), List.of("-a, --beta are mutually exclusive.")),
            Arguments.of(List.of(PARSED_C, PARSED_A), List.of("-c, -a are mutually exclusive.")),
            Arguments.of(List.of(PARSED_B, PARSED_C, PARSED_A), List.of("--beta, -c, -a are mutually exclusive."))
        );
    }

    @Test
    void requireOneOfUsesSingularSentenceForOneName() {
        assertThat(messages(requireOneOf("key"))).containsExactly("--key is required.");
        assertThat(messages(requireOneOf("key"), new ParsedOption(KEY, "-k", "id_rsa"))).isEmpty();
    }

    @Test
    void requireOneOfUsesPluralSentenceForSeveralNames() {
        assertThat(messages(requireOneOf("a", "beta"))).containsExactly("--alpha, --beta at least one is required.");
        assertThat(messages(requireOneOf("a", "beta"), PARSED_B)).isEmpty();
    }

    @Test
    void ifPresentThenIsSatisfiedWhenTriggerIsAbsent() {
        assertThat(messages(ifPresentThen("a", requireOneOf("key")), PARSED_B)).isEmpty();
    }

    @Test
    void ifPresentThenPrefixesInnerViolationWithTrigger() {
        assertThat(messages(ifPresentThen("a", requireOneOf("key")), PARSED_A))
            .containsExactly("If --alpha is present then --key is required.");
        assertThat(messages(ifPresentThen("a", requireOneOf("key")), PARSED_A, new ParsedOption(KEY, "--key", "k")))
            .isEmpty();
    }

    @Test
    void ifPresentThenNests() {
        final var nested = ifPresentThen("a", ifPresentThen("b", exclusive("c", "key")));

        assertThat(messages(nested, PARSED_A, PARSED_B, PARSED_C, new ParsedOption(KEY, "-k", "k")))
            .containsExactly("If --alpha is present then If --beta is present then -c, -k are mutually exclusive.");
        assertThat(messages(nested, PARSED_A, PARSED_C, new ParsedOption(KEY, "-k", "k"))).isEmpty();
    }

    @ParameterizedTest
    @MethodSource("rangeProvider")
    void rangeChecksInclusiveBounds(final String literal, final List<String> expected) {
        assertThat(messages(range("level", 1, 10), level(literal))).isEqualTo(expected);
    }

    static Stream<Arguments> rangeProvider() {
        return Stream.of(
            Arguments.of("1", List.of()),
            Arguments.of("10", List.of()),
            Arguments.of("5.5", List.of()),
            Arguments.of(" 7 ", List.of()),
            Arguments.of("0", List.of("--level has value in range [1, 10].")),
            Arguments.of("15", List.of("--level has value in range [1, 10].")),
            Arguments.of("abc", List.of("Invalid argument value: --level abc")),
            Arguments.of("5d", List.of("Invalid argument value: --level 5d")),
            Arguments.of("5f", List.of("Invalid argument value: --level 5f")),
            Arguments.of("0x1p2", List.of("Invalid argument value: --level 0x1p2"))
        );
    }

    @Test
    void rangeIsSatisfiedWhenOptionIsAbsent() {
        assertThat(messages(range("level", 1, 10), PARSED_A)).isEmpty();
    }

    @Test
    void rangeKeepsFractionalBounds() {
        assertThat(messages(range("level", 0.5, 2.5), level("3")))
            .containsExactly("--level has value in range [0.5, 2.5].");
    }

    @Test
    void rangeRejectsEmptyInterval() {
        assertThatThrownBy(() -> range("level", 5, 5))
            .isInstanceOf(ConfigurationError.class)
            .hasMessage("Min value must be smaller than max value, but received [5, 5].");
        assertThatThrownBy(() -> range("level", 10, 1)).isInstanceOf(ConfigurationError.class);
    }

    @Test
    void everyRequirementIsEvaluated() {
        final var errors = OptionRequirements.validate(
            DEFINITIONS,
            List.of(exclusive("a", "b"), requireOneOf("key"), range("level", 1, 10)),
            List.of(PARSED_A, PARSED_B, level("11")));

        assertThat(errors).extracting(OptionRequirementError::message).containsExactly(
            "-a, --beta are mutually exclusive.",
            "--key is required.",
            "--level has value in range [1, 10].");
    }

    @Test
    void helpLinesUseLongNames() {
        assertThat(OptionRequirements.helpLine(DEFINITIONS, exclusive("a", "-b")))
            .isEqualTo("--alpha, --beta are mutually exclusive.");
        assertThat(OptionRequirements.helpLine(DEFINITIONS, requireOneOf("k")))
            .isEqualTo("--key is required.");
        assertThat(OptionRequirements.helpLine(DEFINITIONS, ifPresentThen("a", requireOneOf("key", "level"))))
            .isEqualTo("If --alpha is present then --key, --level at least one is required.");
        assertThat(OptionRequirements.helpLine(DEFINITIONS, range("level", 1, 10)))
            .isEqualTo("--level has value in range [1, 10].");
    }

    @Test
    void undeclaredNameIsAConfigurationError() {
        assertThatThrownBy(() -> OptionRequirements.helpLine(DEFINITIONS, requireOneOf("delta")))
            .isInstanceOf(ConfigurationError.class)
            .hasMessage("Option 'delta' is not declared by this command.");
        assertThatThrownBy(() -> OptionRequirements.checkReferences(DEFINITIONS, List.of(exclusive("a", "delta"))))
            .isInstanceOf(ConfigurationError.class);
    }

    @Test
    void formatBoundDropsIntegralFraction() {
        assertThat(OptionRequirements.formatBound(10)).isEqualTo("10");
        assertThat(OptionRequirements.formatBound(-3)).isEqualTo("-3");
        assertThat(OptionRequirements.formatBound(0.25)).isEqualTo("0.25");
        assertThat(OptionRequirements.formatBound(1e19)).isEqualTo("10000000000000000000");
    }

    @Test
    void largeBoundsAreRenderedExactly() {
        assertThat(OptionRequirements.helpLine(DEFINITIONS, range("level", 0, 1e19)))
            .isEqualTo("--level has value in range [0, 10000000000000000000].");
        assertThat(messages(range("level", 0, 1e19), level("2e19")))
            .containsExactly("--level has value in range [0, 10000000000000000000].");
    }
}
