package xyz.firestige.pipeline.domain.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 凭据绑定：只引用凭据 ID，密文在执行时才从密钥库解析
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "credentialId", "variable", "usernameVariable", "passwordVariable"})
public final class CredentialBinding {

    private final CredentialType type;
    private final String credentialId;
    private final String variable;
    private final String usernameVariable;
    private final String passwordVariable;

    @JsonCreator
    public CredentialBinding(
            @JsonProperty("type") CredentialType type,
            @JsonProperty("credentialId") String credentialId,
            @JsonProperty("variable") String variable,
            @JsonProperty("usernameVariable") String usernameVariable,
            @JsonProperty("passwordVariable") String passwordVariable) {
        this.type = type != null ? type : CredentialType.STRING;
        this.credentialId = credentialId;
        this.variable = variable;
        this.usernameVariable = usernameVariable;
        this.passwordVariable = passwordVariable;
    }

    public static CredentialBinding string(String credentialId, String variable) {
        return new CredentialBinding(CredentialType.STRING, credentialId, variable, null, null);
    }

    public static CredentialBinding usernamePassword(String credentialId, String usernameVariable, String passwordVariable) {
        return new CredentialBinding(CredentialType.USERNAME_PASSWORD, credentialId, null, usernameVariable, passwordVariable);
    }

    public CredentialType getType() {
        return type;
    }

    public String getCredentialId() {
        return credentialId;
    }

    public String getVariable() {
        return variable;
    }

    public String getUsernameVariable() {
        return usernameVariable;
    }

    public String getPasswordVariable() {
        return passwordVariable;
    }

    /**
     * 本绑定向执行环境暴露的变量名
     */
    @JsonIgnore
    public List<String> getExposedVariables() {
        List<String> names = new ArrayList<>();
        if (type == CredentialType.USERNAME_PASSWORD) {
            names.add(usernameVariable);
            names.add(passwordVariable);
        } else {
            names.add(variable);
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CredentialBinding that = (CredentialBinding) o;
        return type == that.type
                && Objects.equals(credentialId, that.credentialId)
                && Objects.equals(variable, that.variable)
                && Objects.equals(usernameVariable, that.usernameVariable)
                && Objects.equals(passwordVariable, that.passwordVariable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, credentialId, variable, usernameVariable, passwordVariable);
    }

    @Override
    public String toString() {
        return "CredentialBinding{" + type + ", credentialId='" + credentialId + "'}";
    }
}
