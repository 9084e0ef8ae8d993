package xyz.firestige.pipeline.cli;

import xyz.firestige.pipeline.domain.run.ExecutionStatus;

/**
 * 命令行退出码
 */
public enum CliExitCode {

    OK(0),
    FAILURE(1),
    ABORTED(2),
    /**
     * 定义校验失败或命令用法错误
     */
    INVALID(3),
    /**
     * 运行被拒绝（已有运行在执行）或运行不存在
     */
    REJECTED(4);

    private final int code;

    CliExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * SUCCESS / UNSTABLE 视为成功；未结束的运行查询成功也返回 0
     */
    public static CliExitCode forStatus(ExecutionStatus status) {
        switch (status) {
            case FAILURE:
                return FAILURE;
            case ABORTED:
                return ABORTED;
            default:
                return OK;
        }
    }
}
