package xyz.firestige.pipeline.domain.definition;

/**
 * 凭据绑定类型
 */
public enum CredentialType {

    /**
     * 单值密文（token、口令），暴露为一个变量
     */
    STRING,

    /**
     * 用户名 + 密码，暴露为两个变量
     */
    USERNAME_PASSWORD
}
