package xyz.firestige.pipeline.domain.shared;

import java.time.Duration;

/**
 * 引擎内部以纳秒计时，可表示的最长时长约 292 年
 */
public final class DurationLimits {

    public static final Duration MAX = Duration.ofNanos(Long.MAX_VALUE);

    private DurationLimits() {
    }

    public static boolean isRepresentable(Duration duration) {
        return duration.compareTo(MAX) <= 0;
    }

    /**
     * 超出范围时取 {@link Long#MAX_VALUE}，即视为不限时
     */
    public static long toNanosSaturated(Duration duration) {
        return isRepresentable(duration) ? duration.toNanos() : Long.MAX_VALUE;
    }
}
