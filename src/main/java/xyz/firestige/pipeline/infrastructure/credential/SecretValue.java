package xyz.firestige.pipeline.infrastructure.credential;

/**
 * 从密钥库解析出的凭据值；toString 不输出密文
 */
public final class SecretValue {

    private final String username;
    private final String secret;

    private SecretValue(String username, String secret) {
        this.username = username;
        this.secret = secret;
    }

    public static SecretValue of(String secret) {
        return new SecretValue(null, secret);
    }

    public static SecretValue of(String username, String secret) {
        return new SecretValue(username, secret);
    }

    public String getUsername() {
        return username;
    }

    public String getSecret() {
        return secret;
    }

    @Override
    public String toString() {
        return "SecretValue{username=" + (username != null ? "****" : null) + ", secret=****}";
    }
}
