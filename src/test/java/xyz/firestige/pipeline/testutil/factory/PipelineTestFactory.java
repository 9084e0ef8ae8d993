package xyz.firestige.pipeline.testutil.factory;

import com.github.javafaker.Faker;
import xyz.firestige.pipeline.domain.shared.vo.RunId;
import xyz.firestige.pipeline.infrastructure.credential.SecretValue;

import java.util.Locale;

/**
 * 测试数据工厂
 * <p>
 * 用途：生成随机的流水线名称、运行标识与凭据，避免测试依赖固定字面量
 */
public class PipelineTestFactory {

    private static final Faker FAKER = new Faker();

    /**
     * 生成随机流水线名称（小写字母与连字符）
     */
    public static String randomPipelineName() {
        return FAKER.app().name().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-")
                + "-" + FAKER.number().digits(4);
    }

    public static RunId randomRunId() {
        return RunId.of(randomPipelineName(), FAKER.number().numberBetween(1, 10_000));
    }

    /**
     * 生成随机密文，长度足以避免与普通输出偶然重合
     */
    public static String randomSecret() {
        return FAKER.internet().password(16, 32, true, false);
    }

    public static SecretValue randomUsernamePassword() {
        return SecretValue.of(FAKER.name().username(), randomSecret());
    }

    public static String randomVersion() {
        return FAKER.app().version();
    }
}
