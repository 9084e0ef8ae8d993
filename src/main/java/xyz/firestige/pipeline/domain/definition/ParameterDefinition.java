package xyz.firestige.pipeline.domain.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * 流水线参数声明；没有默认值的参数在启动运行时必须提供
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "defaultValue", "description"})
public final class ParameterDefinition {

    private final String name;
    private final String defaultValue;
    private final String description;

    @JsonCreator
    public ParameterDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("defaultValue") String defaultValue,
            @JsonProperty("description") String description) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.description = description;
    }

    public static ParameterDefinition of(String name, String defaultValue) {
        return new ParameterDefinition(name, defaultValue, null);
    }

    public String getName() {
        return name;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    @JsonIgnore
    public boolean isRequired() {
        return defaultValue == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterDefinition that = (ParameterDefinition) o;
        return Objects.equals(name, that.name)
                && Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, defaultValue, description);
    }
}
