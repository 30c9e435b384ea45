package cmdtree.cli;

import cmdtree.cli.requirement.OptionRequirementError;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@Accessors(fluent = true)
public class RequirementViolationError extends ParseError {
    private final List<OptionRequirementError> errors;

    public RequirementViolationError(final List<OptionRequirementError> errors) {
        super(errors.stream().map(OptionRequirementError::message).collect(Collectors.joining("\n")));
        this.errors = List.copyOf(errors);
    }
}
