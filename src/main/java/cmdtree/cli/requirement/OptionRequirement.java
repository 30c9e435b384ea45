package cmdtree.cli.requirement;

import cmdtree.common.ErrorFactory;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Objects;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public abstract class OptionRequirement {
    public enum Kind {
        EXCLUSIVE,
        REQUIRE_ONE_OF,
        IF_PRESENT_THEN,
        RANGE
    }

    private final Kind kind;

    private final List<String> optionNames;

    private OptionRequirement(final Kind kind, final List<String> optionNames) {
        this.kind = kind;
        this.optionNames = List.copyOf(optionNames);
    }

    public static Exclusive exclusive(final String... optionNames) {
        return new Exclusive(List.of(optionNames));
    }

    public static RequireOneOf requireOneOf(final String... optionNames) {
        return new RequireOneOf(List.of(optionNames));
    }

    public static IfPresentThen ifPresentThen(final String optionName, final OptionRequirement then) {
        return new IfPresentThen(optionName, then);
    }

    public static Range range(final String optionName, final double minValue, final double maxValue) {
        return new Range(optionName, minValue, maxValue);
    }

    public static final class Exclusive extends OptionRequirement {
        private Exclusive(final List<String> optionNames) {
            super(Kind.EXCLUSIVE, optionNames);
        }
    }

    public static final class RequireOneOf extends OptionRequirement {
        private RequireOneOf(final List<String> optionNames) {
            super(Kind.REQUIRE_ONE_OF, optionNames);
        }
    }

    @Getter
    @Accessors(fluent = true)
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class IfPresentThen extends OptionRequirement {
        private final OptionRequirement then;

        private IfPresentThen(final String optionName, final OptionRequirement then) {
            super(Kind.IF_PRESENT_THEN, List.of(optionName));
            this.then = Objects.requireNonNull(then, "then");
        }

        public String optionName() {
            return optionNames().get(0);
        }
    }

    @Getter
    @Accessors(fluent = true)
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class Range extends OptionRequirement {
        private final double minValue;

        private final double maxValue;

        private Range(final String optionName, final double minValue, final double maxValue) {
            super(Kind.RANGE, List.of(optionName));
            if (!(minValue < maxValue)) {
                throw ErrorFactory.invalidRange(OptionRequirements.formatBound(minValue), OptionRequirements.formatBound(maxValue));
            }
            this.minValue = minValue;
            this.maxValue = maxValue;
        }

        public String optionName() {
            return optionNames().get(0);
        }

        public boolean contains(final double value) {
            return value >= minValue && value <= maxValue;
        }
    }
}
