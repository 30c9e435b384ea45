package cmdtree.cli.option;

import cmdtree.cli.ConfigurationError;
import cmdtree.cli.ParseError;
import cmdtree.cli.requirement.OptionRequirement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptionParserTest {
    private static final OptionDefinition TAG = OptionDefinition.of("--tag", "-t", "Tag.", ArgumentKind.STRING);
    private static final OptionDefinition QUIET = OptionDefinition.flag("--quiet", "-q", "Quiet.");
    private static final OptionDefinition SIZE = OptionDefinition.of("--size", null, "Size.", ArgumentKind.INT, ArgumentKind.INT);

    private static OptionParser parser() {
        return OptionParser.builder()
            .definition(TAG)
            .definition(QUIET)
            .definition(SIZE)
            .build();
    }

    @Test
    void givenValueOptionThenUnknownToken_thenParsingStopsAtUnknownToken() throws ParseError {
        final var parsed = parser().parse(List.of("--tag", "latest", "myrepo", "-q"));

        assertThat(parsed.consumed()).isEqualTo(2);
        assertThat(parsed.options()).containsExactly(new ParsedOption(TAG, "--tag", "latest"));
        assertThat(parsed.remaining()).containsExactly("myrepo", "-q");
    }

    @Test
    void givenFlag_thenParsedWithNoArguments() throws ParseError {
        final var parsed = parser().parse(List.of("-q"));

        assertThat(parsed.options()).hasSize(1);
        assertThat(parsed.options().get(0).parsedArgs()).isEmpty();
        assertThat(parsed.isPresent("quiet")).isTrue();
        assertThat(parsed.remaining()).isEmpty();
    }

    @Test
    void givenShortAndLongForms_thenLiteralTokenIsKeptInEncounterOrder() throws ParseError {
        final var parsed = parser().parse(List.of("-q", "--size", "3", "4", "-t", "v1"));

        assertThat(parsed.options()).extracting(ParsedOption::parsedName).containsExactly("-q", "--size", "-t");
        assertThat(parsed.find("size").orElseThrow().parsedArgs()).containsExactly("3", "4");
        assertThat(parsed.find("-t").orElseThrow().option()).isEqualTo(TAG);
    }

    @Test
    void givenNumericLookingValues_thenNothingIsCoerced() throws ParseError {
        final var parsed = parser().parse(List.of("--size", "big", "-1"));

        assertThat(parsed.find("size").orElseThrow().parsedArgs()).containsExactly("big", "-1");
    }

    @Test
    void givenValueLookingLikeAnOption_thenItIsConsumedVerbatim() throws ParseError {
        final var parsed = parser().parse(List.of("--tag", "-q"));

        assertThat(parsed.options()).containsExactly(new ParsedOption(TAG, "--tag", "-q"));
        assertThat(parsed.isPresent("quiet")).isFalse();
    }

    @ParameterizedTest
    @MethodSource("failureProvider")
    void parserParseReturnsFailure(final List<String> in, final String cause) {
        assertThatThrownBy(() -> parser().parse(in))
            .isInstanceOf(ParseError.class)
            .hasMessage(cause);
    }

    static Stream<Arguments> failureProvider() {
        return Stream.of(
            Arguments.of(List.of("--tag"), "No valid argument was found following the --tag option, expected: string"),
            Arguments.of(List.of("-q", "--size", "1"), "No valid argument was found following the --size option, expected: int int"),
            Arguments.of(List.of("-t", "a", "--tag", "b"), "--tag was specified more than once (-t, --tag)."),
            Arguments.of(List.of("-q", "-q"), "--quiet was specified more than once (-q, -q).")
        );
    }

    @Test
    void givenNoTokens_thenNothingIsConsumed() throws ParseError {
        final var parsed = OptionParser.none().parse(List.of());

        assertThat(parsed.consumed()).isZero();
        assertThat(parsed.options()).isEmpty();
        assertThat(parsed.remaining()).isEmpty();
    }

    @Test
    void givenNoDefinitions_thenFirstTokenEndsOptions() throws ParseError {
        final var parsed = OptionParser.none().parse(List.of("-q", "x"));

        assertThat(parsed.consumed()).isZero();
        assertThat(parsed.remaining()).containsExactly("-q", "x");
    }

    @Test
    void givenDuplicateDefinitionNames_thenConfigurationError() {
        assertThatThrownBy(() -> OptionParser.builder()
            .definition(TAG)
            .definition(OptionDefinition.flag("--other", "-t", "Clashes on -t."))
            .build())
            .isInstanceOf(ConfigurationError.class)
            .hasMessageContaining("-t");
    }

    @Test
    void givenNamesEqualWithoutDashes_thenConfigurationError() {
        assertThatThrownBy(() -> OptionParser.builder()
            .definition(OptionDefinition.flag("--v", null, "Long only."))
            .definition(OptionDefinition.flag("--verbose", "-v", "Short clashes without dashes."))
            .build())
            .isInstanceOf(ConfigurationError.class)
            .hasMessage("Option name 'v' would refer to both --v and -v.");
    }

    @Test
    void givenOneOptionWithMatchingLongAndShortName_thenItIsAccepted() {
        final var parser = OptionParser.builder()
            .definition(OptionDefinition.flag("--v", "-v", "Both forms."))
            .build();

        assertThat(parser.definition("v").longName()).isEqualTo("--v");
    }

    @Test
    void givenRequirementOnUndeclaredOption_thenConfigurationError() {
        assertThatThrownBy(() -> OptionParser.builder()
            .definition(TAG)
            .requirement(OptionRequirement.ifPresentThen("tag", OptionRequirement.requireOneOf("missing")))
            .build())
            .isInstanceOf(ConfigurationError.class)
            .hasMessage("Option 'missing' is not declared by this command.");
    }

    @Test
    void givenRangeOnFlag_thenConfigurationError() {
        assertThatThrownBy(() -> OptionParser.builder()
            .definition(QUIET)
            .requirement(OptionRequirement.range("quiet", 0, 1))
            .build())
            .isInstanceOf(ConfigurationError.class);
    }

    @Test
    void givenRequireOneOf_thenOptionsAreRequiredUnlessOverridden() {
        final var derived = OptionParser.builder()
            .definition(TAG)
            .requirement(OptionRequirement.requireOneOf("tag"))
            .build();
        final var overridden = OptionParser.builder()
            .definition(TAG)
            .requirement(OptionRequirement.requireOneOf("tag"))
            .required(false)
            .build();

        assertThat(derived.required()).isTrue();
        assertThat(overridden.required()).isFalse();
        assertThat(parser().required()).isFalse();
    }

    @Test
    void givenUndeclaredName_thenDefinitionLookupFails() {
        assertThat(parser().definition("t")).isEqualTo(TAG);
        assertThatThrownBy(() -> parser().definition("nope")).isInstanceOf(ConfigurationError.class);
    }
}
