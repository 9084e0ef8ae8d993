package xyz.firestige.pipeline.infrastructure.credential;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.definition.CredentialBinding;
import xyz.firestige.pipeline.domain.definition.CredentialType;
import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.StepAttempt;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 凭据作用域管理器
 * <p>
 * 职责：
 * 1. 仅在作用域内通过 {@link SecretStore} 解析凭据
 * 2. 将凭据以绑定的变量名注入环境副本，并登记到遮蔽器
 * 3. 任意退出路径上清除凭据变量，并对结果中的失败消息做遮蔽
 */
public class CredentialScopeManager {

    private static final Logger log = LoggerFactory.getLogger(CredentialScopeManager.class);

    private final SecretStore secretStore;

    public CredentialScopeManager(SecretStore secretStore) {
        this.secretStore = secretStore;
    }

    /**
     * 在凭据作用域内执行
     *
     * @throws CredentialResolutionException 任一绑定无法解析（此时 block 不会执行）
     */
    public ExecutionResult withCredentials(List<CredentialBinding> bindings,
                                           Map<String, String> baseEnvironment,
                                           Function<CredentialScope, ExecutionResult> block) {
        CredentialScope scope = open(bindings, baseEnvironment);
        try {
            ExecutionResult result = block.apply(scope);
            scrubResult(result, scope);
            return result;
        } catch (RuntimeException e) {
            throw maskedException(e, scope);
        } finally {
            scope.close();
            if (!bindings.isEmpty()) {
                log.debug("凭据作用域已关闭，清除变量: {}", scope.getInjectedVariables());
            }
        }
    }

    CredentialScope open(List<CredentialBinding> bindings, Map<String, String> baseEnvironment) {
        Map<String, String> environment = new LinkedHashMap<>(baseEnvironment);
        List<String> injected = new ArrayList<>();
        SecretMasker masker = new SecretMasker();
        try {
            for (CredentialBinding binding : bindings) {
                SecretValue value = secretStore.resolve(binding.getCredentialId());
                if (binding.getType() == CredentialType.USERNAME_PASSWORD) {
                    if (value.getUsername() == null) {
                        throw new CredentialResolutionException(binding.getCredentialId(),
                                "凭据缺少用户名: " + binding.getCredentialId());
                    }
                    environment.put(binding.getUsernameVariable(), value.getUsername());
                    environment.put(binding.getPasswordVariable(), value.getSecret());
                    injected.add(binding.getUsernameVariable());
                    injected.add(binding.getPasswordVariable());
                    masker.register(value.getUsername());
                } else {
                    environment.put(binding.getVariable(), value.getSecret());
                    injected.add(binding.getVariable());
                }
                masker.register(value.getSecret());
                log.debug("凭据已注入: credentialId={}, store={}", binding.getCredentialId(), secretStore.getName());
            }
        } catch (RuntimeException e) {
            injected.forEach(environment::remove);
            masker.clear();
            throw e;
        }
        return new CredentialScope(environment, injected, masker);
    }

    private void scrubResult(ExecutionResult result, CredentialScope scope) {
        if (result == null || scope.getMasker().isEmpty()) {
            return;
        }
        if (result.getFailureInfo() != null) {
            result.setFailureInfo(result.getFailureInfo().withMessage(scope::mask));
        }
        for (StepAttempt attempt : result.getAttempts()) {
            if (attempt.getFailureInfo() != null) {
                attempt.setFailureInfo(attempt.getFailureInfo().withMessage(scope::mask));
            }
        }
    }

    private PipelineException maskedException(RuntimeException e, CredentialScope scope) {
        ErrorType errorType = e instanceof PipelineException
                ? ((PipelineException) e).getErrorType()
                : ErrorType.SYSTEM_ERROR;
        PipelineException masked = new PipelineException(errorType, scope.mask(String.valueOf(e.getMessage())));
        masked.setStackTrace(e.getStackTrace());
        return masked;
    }
}
