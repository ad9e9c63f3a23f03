package im.arun.contenttree.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationIssue {
    String id;
    String ruleId;
    String nodeId;
    String nodeName;
    Severity severity;
    String message;
    SuggestedFix suggestedFix;

    public Optional<SuggestedFix> fix() {
        return Optional.ofNullable(suggestedFix);
    }
}
