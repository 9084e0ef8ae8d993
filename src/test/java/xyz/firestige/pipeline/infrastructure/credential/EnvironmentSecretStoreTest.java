package xyz.firestige.pipeline.infrastructure.credential;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EnvironmentSecretStore 单元测试")
class EnvironmentSecretStoreTest {

    @Test
    @DisplayName("凭据 ID 转换为大写变量名，非字母数字替换为下划线")
    void variableNameNormalizesId() {
        assertThat(EnvironmentSecretStore.variableName("docker-hub.prod")).isEqualTo("CRED_DOCKER_HUB_PROD");
    }

    @Test
    @DisplayName("读取字符串凭据")
    void resolvesStringCredential() {
        EnvironmentSecretStore store = new EnvironmentSecretStore(Map.of("CRED_DEPLOY_TOKEN", "t0k3n"));

        SecretValue value = store.resolve("deploy-token");

        assertThat(value.getUsername()).isNull();
        assertThat(value.getSecret()).isEqualTo("t0k3n");
        assertThat(value.toString()).doesNotContain("t0k3n");
    }

    @Test
    @DisplayName("_USR 与 _PSW 同时存在时解析为用户名密码")
    void resolvesUsernamePassword() {
        EnvironmentSecretStore store = new EnvironmentSecretStore(Map.of(
                "CRED_REGISTRY_USR", "ci",
                "CRED_REGISTRY_PSW", "pa55"));

        SecretValue value = store.resolve("registry");

        assertThat(value.getUsername()).isEqualTo("ci");
        assertThat(value.getSecret()).isEqualTo("pa55");
    }

    @Test
    @DisplayName("缺失的凭据抛出 CredentialResolutionException")
    void missingCredentialFails() {
        EnvironmentSecretStore store = new EnvironmentSecretStore(Map.of());

        assertThatThrownBy(() -> store.resolve("nope"))
                .isInstanceOf(CredentialResolutionException.class)
                .hasMessageContaining("CRED_NOPE");
        assertThatThrownBy(() -> store.resolve(" "))
                .isInstanceOf(CredentialResolutionException.class);
    }
}
