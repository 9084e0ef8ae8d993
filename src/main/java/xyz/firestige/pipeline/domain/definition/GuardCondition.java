package xyz.firestige.pipeline.domain.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stage 守卫条件
 * <p>
 * 形如 {@code when: {parameter: BRANCH, equals: main}}，参数之外必须恰好给出
 * equals / notEquals / matches 中的一个。求值前由校验器保证结构合法。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"parameter", "equals", "notEquals", "matches"})
public final class GuardCondition {

    private final String parameter;
    private final String equalsValue;
    private final String notEqualsValue;
    private final String matches;

    @JsonCreator
    public GuardCondition(
            @JsonProperty("parameter") String parameter,
            @JsonProperty("equals") String equalsValue,
            @JsonProperty("notEquals") String notEqualsValue,
            @JsonProperty("matches") String matches) {
        this.parameter = parameter;
        this.equalsValue = equalsValue;
        this.notEqualsValue = notEqualsValue;
        this.matches = matches;
    }

    public static GuardCondition equalTo(String parameter, String value) {
        return new GuardCondition(parameter, value, null, null);
    }

    public static GuardCondition notEqualTo(String parameter, String value) {
        return new GuardCondition(parameter, null, value, null);
    }

    public static GuardCondition matching(String parameter, String regex) {
        return new GuardCondition(parameter, null, null, regex);
    }

    public String getParameter() {
        return parameter;
    }

    @JsonProperty("equals")
    public String getEqualsValue() {
        return equalsValue;
    }

    @JsonProperty("notEquals")
    public String getNotEqualsValue() {
        return notEqualsValue;
    }

    public String getMatches() {
        return matches;
    }

    /**
     * 已给出的比较算子个数，合法条件恰好为 1
     */
    @JsonIgnore
    public int operatorCount() {
        int count = 0;
        if (equalsValue != null) count++;
        if (notEqualsValue != null) count++;
        if (matches != null) count++;
        return count;
    }

    /**
     * 按运行参数求值；参数缺失时按 null 比较（equals 不成立，notEquals 成立）
     */
    public boolean evaluate(Map<String, String> parameters) {
        String actual = parameters != null ? parameters.get(parameter) : null;
        if (equalsValue != null) {
            return equalsValue.equals(actual);
        }
        if (notEqualsValue != null) {
            return !notEqualsValue.equals(actual);
        }
        if (matches != null) {
            return actual != null && Pattern.compile(matches).matcher(actual).matches();
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GuardCondition that = (GuardCondition) o;
        return Objects.equals(parameter, that.parameter)
                && Objects.equals(equalsValue, that.equalsValue)
                && Objects.equals(notEqualsValue, that.notEqualsValue)
                && Objects.equals(matches, that.matches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameter, equalsValue, notEqualsValue, matches);
    }

    @Override
    public String toString() {
        if (equalsValue != null) return parameter + " == " + equalsValue;
        if (notEqualsValue != null) return parameter + " != " + notEqualsValue;
        if (matches != null) return parameter + " =~ " + matches;
        return parameter + " (no operator)";
    }
}
