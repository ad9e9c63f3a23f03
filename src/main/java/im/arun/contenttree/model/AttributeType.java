package im.arun.contenttree.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AttributeType {
    @JsonProperty("text") TEXT,
    @JsonProperty("boolean") BOOLEAN,
    @JsonProperty("number") NUMBER,
    @JsonProperty("select") SELECT
}
