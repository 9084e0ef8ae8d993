package xyz.firestige.pipeline.infrastructure.credential;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.domain.definition.CredentialBinding;
import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.run.ResultType;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;
import xyz.firestige.pipeline.testutil.factory.PipelineTestFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CredentialScopeManager 单元测试")
class CredentialScopeManagerTest {

    private CredentialScopeManager manager;

    @BeforeEach
    void setUp() {
        InMemorySecretStore store = new InMemorySecretStore()
                .put("deploy-token", SecretValue.of("t0k3n"))
                .put("registry", SecretValue.of("ci-bot", "pa55word"))
                .put("plain", SecretValue.of("only-secret"));
        manager = new CredentialScopeManager(store);
    }

    @Test
    @DisplayName("场景: 作用域内可见凭据变量，退出后变量被移除")
    void injectsAndRemovesVariables() {
        // Given
        List<CredentialBinding> bindings = List.of(
                CredentialBinding.string("deploy-token", "DEPLOY_TOKEN"),
                CredentialBinding.usernamePassword("registry", "REG_USER", "REG_PASS"));
        AtomicReference<CredentialScope> captured = new AtomicReference<>();

        // When
        ExecutionResult result = manager.withCredentials(bindings, Map.of("APP", "web"), scope -> {
            captured.set(scope);
            assertThat(scope.getEnvironment())
                    .containsEntry("APP", "web")
                    .containsEntry("DEPLOY_TOKEN", "t0k3n")
                    .containsEntry("REG_USER", "ci-bot")
                    .containsEntry("REG_PASS", "pa55word");
            ExecutionResult r = ExecutionResult.pending("deploy/push", "push", ResultType.STEP);
            r.start();
            r.success();
            return r;
        });

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        CredentialScope scope = captured.get();
        assertThat(scope.isClosed()).isTrue();
        assertThat(scope.getInjectedVariables()).containsExactly("DEPLOY_TOKEN", "REG_USER", "REG_PASS");
        assertThat(scope.getEnvironment()).containsOnlyKeys("APP");
        assertThat(scope.getMasker().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("场景: 失败消息中的密文被遮蔽")
    void failureMessageIsMasked() {
        // Given
        List<CredentialBinding> bindings = List.of(CredentialBinding.string("deploy-token", "DEPLOY_TOKEN"));

        // When
        ExecutionResult result = manager.withCredentials(bindings, Map.of(), scope -> {
            ExecutionResult r = ExecutionResult.pending("deploy/push", "push", ResultType.STEP);
            r.start();
            r.failure(FailureInfo.of(ErrorType.STEP_FAILURE, "curl -H 'Bearer t0k3n' 返回 401", "deploy/push"));
            return r;
        });

        // Then
        assertThat(result.getFailureInfo().getErrorMessage())
                .doesNotContain("t0k3n")
                .contains(SecretMasker.MASK);
    }

    @Test
    @DisplayName("场景: 代码块抛出的异常消息同样被遮蔽")
    void exceptionMessageIsMasked() {
        List<CredentialBinding> bindings = List.of(CredentialBinding.string("plain", "SECRET"));

        assertThatThrownBy(() -> manager.withCredentials(bindings, Map.of(), scope -> {
            throw new IllegalStateException("连接失败: only-secret");
        }))
                .isInstanceOf(PipelineException.class)
                .hasMessageNotContaining("only-secret")
                .hasMessageContaining(SecretMasker.MASK);
    }

    @Test
    @DisplayName("场景: 用户名与密码都登记到遮蔽器")
    void usernameAndPasswordAreMasked() {
        // Given
        SecretValue generated = PipelineTestFactory.randomUsernamePassword();
        CredentialScopeManager scoped = new CredentialScopeManager(new InMemorySecretStore().put("registry", generated));
        List<CredentialBinding> bindings = List.of(CredentialBinding.usernamePassword("registry", "U", "P"));

        // When
        String masked = scoped.withCredentials(bindings, Map.of(), scope -> {
            ExecutionResult r = ExecutionResult.pending("publish", "publish", ResultType.STEP);
            r.start();
            r.failure(FailureInfo.of(ErrorType.STEP_FAILURE,
                    "login " + generated.getUsername() + "/" + generated.getSecret() + " rejected", "publish"));
            return r;
        }).getFailureInfo().getErrorMessage();

        // Then
        assertThat(masked).isEqualTo("login ****/**** rejected");
    }

    @Test
    @DisplayName("场景: 凭据无法解析时代码块不执行")
    void unresolvedCredentialSkipsBlock() {
        // Given
        List<CredentialBinding> bindings = List.of(
                CredentialBinding.string("deploy-token", "DEPLOY_TOKEN"),
                CredentialBinding.string("missing", "MISSING"));
        AtomicBoolean invoked = new AtomicBoolean();

        // When / Then
        assertThatThrownBy(() -> manager.withCredentials(bindings, Map.of(), scope -> {
            invoked.set(true);
            return null;
        }))
                .isInstanceOf(CredentialResolutionException.class)
                .satisfies(e -> assertThat(((CredentialResolutionException) e).getCredentialId()).isEqualTo("missing"));
        assertThat(invoked).isFalse();
    }

    @Test
    @DisplayName("场景: 用户名密码绑定到只有密文的凭据时报错")
    void usernamePasswordRequiresUsername() {
        List<CredentialBinding> bindings = List.of(CredentialBinding.usernamePassword("plain", "U", "P"));

        assertThatThrownBy(() -> manager.open(bindings, Map.of()))
                .isInstanceOf(CredentialResolutionException.class)
                .hasMessageContaining("plain");
    }
}
