package xyz.firestige.pipeline.infrastructure.execution;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 引擎运行参数（来自 {@code pipeline.*} 配置）
 *
 * @param workspaceRoot    工作区根目录，每条流水线一个子目录
 * @param lockTtl          资源锁与运行锁的 TTL，持有期间按 TTL/3 续期
 * @param lockPollInterval 阻塞获取锁时的轮询间隔
 */
public record EngineSettings(Path workspaceRoot, Duration lockTtl, Duration lockPollInterval) {
}
