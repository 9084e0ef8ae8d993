package xyz.firestige.pipeline.infrastructure.credential;

/**
 * 密钥库
 * 只允许在凭据作用域内调用
 */
public interface SecretStore {

    /**
     * 解析凭据
     *
     * @param credentialId 凭据 ID
     * @return 凭据值
     * @throws CredentialResolutionException 凭据不存在或不可用
     */
    SecretValue resolve(String credentialId);

    /**
     * 获取密钥库名称（用于日志）
     */
    String getName();
}
