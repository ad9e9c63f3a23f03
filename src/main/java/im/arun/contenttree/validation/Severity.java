package im.arun.contenttree.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Severity {
    @JsonProperty("critical") CRITICAL,
    @JsonProperty("warning") WARNING,
    @JsonProperty("optimization") OPTIMIZATION
}
