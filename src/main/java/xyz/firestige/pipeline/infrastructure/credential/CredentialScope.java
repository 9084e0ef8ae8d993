package xyz.firestige.pipeline.infrastructure.credential;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 凭据作用域：一个步骤可见的环境副本（含凭据变量）与对应的遮蔽器
 * <p>
 * 关闭时从环境副本中移除凭据变量并清空遮蔽器。
 */
public class CredentialScope implements AutoCloseable {

    private final Map<String, String> environment;
    private final List<String> injectedVariables;
    private final SecretMasker masker;
    private volatile boolean closed;

    CredentialScope(Map<String, String> environment, List<String> injectedVariables, SecretMasker masker) {
        this.environment = environment;
        this.injectedVariables = List.copyOf(injectedVariables);
        this.masker = masker;
    }

    /**
     * 步骤执行环境（只读视图）
     */
    public Map<String, String> getEnvironment() {
        return Collections.unmodifiableMap(environment);
    }

    public List<String> getInjectedVariables() {
        return injectedVariables;
    }

    public SecretMasker getMasker() {
        return masker;
    }

    public String mask(String text) {
        return masker.mask(text);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        injectedVariables.forEach(environment::remove);
        masker.clear();
        closed = true;
    }
}
