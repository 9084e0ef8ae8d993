package xyz.firestige.pipeline.infrastructure.credential;

import java.util.Locale;
import java.util.Map;

/**
 * 从进程环境变量读取凭据
 * <p>
 * 约定：凭据 {@code docker-hub} 对应 {@code CRED_DOCKER_HUB}；
 * 用户名密码型使用 {@code CRED_DOCKER_HUB_USR} / {@code CRED_DOCKER_HUB_PSW}。
 */
public class EnvironmentSecretStore implements SecretStore {

    public static final String PREFIX = "CRED_";

    private final Map<String, String> environment;

    public EnvironmentSecretStore() {
        this(System.getenv());
    }

    public EnvironmentSecretStore(Map<String, String> environment) {
        this.environment = environment;
    }

    public static String variableName(String credentialId) {
        return PREFIX + credentialId.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }

    @Override
    public SecretValue resolve(String credentialId) {
        if (credentialId == null || credentialId.isBlank()) {
            throw new CredentialResolutionException(credentialId, "凭据 ID 为空");
        }
        String base = variableName(credentialId);
        String username = environment.get(base + "_USR");
        String password = environment.get(base + "_PSW");
        if (username != null && password != null) {
            return SecretValue.of(username, password);
        }
        String secret = environment.get(base);
        if (secret == null) {
            throw new CredentialResolutionException(credentialId,
                    "环境变量中不存在凭据: " + credentialId + " (" + base + ")");
        }
        return SecretValue.of(secret);
    }

    @Override
    public String getName() {
        return "EnvironmentSecretStore";
    }
}
