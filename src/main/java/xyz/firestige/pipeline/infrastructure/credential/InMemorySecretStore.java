package xyz.firestige.pipeline.infrastructure.credential;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存密钥库，默认由 {@code pipeline.credentials.*} 配置填充
 */
public class InMemorySecretStore implements SecretStore {

    private final Map<String, SecretValue> secrets = new ConcurrentHashMap<>();

    public InMemorySecretStore() {
    }

    public InMemorySecretStore(Map<String, SecretValue> secrets) {
        this.secrets.putAll(secrets);
    }

    public InMemorySecretStore put(String credentialId, SecretValue value) {
        secrets.put(credentialId, value);
        return this;
    }

    public void remove(String credentialId) {
        secrets.remove(credentialId);
    }

    @Override
    public SecretValue resolve(String credentialId) {
        SecretValue value = credentialId != null ? secrets.get(credentialId) : null;
        if (value == null || value.getSecret() == null) {
            throw new CredentialResolutionException(credentialId, "凭据不存在: " + credentialId);
        }
        return value;
    }

    @Override
    public String getName() {
        return "InMemorySecretStore";
    }
}
