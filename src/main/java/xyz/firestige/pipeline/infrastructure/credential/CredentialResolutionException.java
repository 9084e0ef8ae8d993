package xyz.firestige.pipeline.infrastructure.credential;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;

/**
 * 密钥库无法提供绑定的凭据；对请求的步骤是致命错误，不重试
 */
public class CredentialResolutionException extends PipelineException {

    private final String credentialId;

    public CredentialResolutionException(String credentialId, String message) {
        super(ErrorType.CREDENTIAL_ERROR, message);
        this.credentialId = credentialId;
    }

    public String getCredentialId() {
        return credentialId;
    }
}
