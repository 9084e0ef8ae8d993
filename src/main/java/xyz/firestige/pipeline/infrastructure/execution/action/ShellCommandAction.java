package xyz.firestige.pipeline.infrastructure.execution.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.run.CancellationToken;
import xyz.firestige.pipeline.infrastructure.execution.output.OutputCapture;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * shell 命令动作（{@code sh}）
 * <p>
 * 通过 {@code sh -c} 启动进程，合并 stdout/stderr 逐行写入输出捕获。
 * 系统提供 {@code setsid} 时，shell 在独立的会话与进程组中启动，组号即 shell 的 pid；
 * 无论正常结束、超时、取消还是中断，退出前都向整个进程组发送 TERM，宽限期后 KILL，
 * shell 已退出而遗留在后台的子进程也会被回收。
 * <p>
 * 没有 {@code setsid} 时只能依据轮询期间观察到的子孙进程回收，退出前才派生的后台进程可能残留。
 */
public class ShellCommandAction implements StepAction {

    public static final String ACTION_ID = "sh";

    /**
     * 以 action 形式调用时，命令放在 {@code with.script}
     */
    public static final String SCRIPT_ARGUMENT = "script";

    /**
     * 被取消时返回的退出码（与 shell 被 SIGTERM 终止一致）
     */
    public static final int CANCELLED_EXIT_CODE = 143;

    private static final Logger log = LoggerFactory.getLogger(ShellCommandAction.class);

    private static final String SETSID = "setsid";

    private final List<String> shell;
    private final Duration pollInterval;
    private final Duration killGracePeriod;
    private final boolean processGroups;

    public ShellCommandAction(List<String> shell, Duration pollInterval, Duration killGracePeriod) {
        this(shell, pollInterval, killGracePeriod, processGroupsSupported());
    }

    ShellCommandAction(List<String> shell, Duration pollInterval, Duration killGracePeriod, boolean processGroups) {
        this.shell = List.copyOf(shell);
        this.pollInterval = pollInterval;
        this.killGracePeriod = killGracePeriod;
        this.processGroups = processGroups;
        if (!processGroups) {
            log.info("未找到 {}，shell 步骤不隔离进程组，只回收观察到的子进程", SETSID);
        }
    }

    /**
     * PATH 中存在可执行的 {@code setsid} 即可为每个步骤建立独立进程组
     */
    public static boolean processGroupsSupported() {
        if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows")) {
            return false;
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        return Arrays.stream(path.split(File.pathSeparator))
                .filter(dir -> !dir.isEmpty())
                .map(dir -> Paths.get(dir, SETSID))
                .anyMatch(Files::isExecutable);
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionOutcome invoke(ActionRequest request) throws Exception {
        String command = request.getCommand() != null
                ? request.getCommand()
                : request.getArgument(SCRIPT_ARGUMENT, null);
        if (command == null || command.isBlank()) {
            return ActionOutcome.failure(2, "shell 命令为空");
        }

        List<String> argv = new ArrayList<>();
        if (processGroups) {
            argv.add(SETSID);
        }
        argv.addAll(shell);
        argv.add(command);
        ProcessBuilder builder = new ProcessBuilder(argv)
                .directory(request.getWorkingDirectory().toFile())
                .redirectErrorStream(true);
        Map<String, String> env = builder.environment();
        env.putAll(request.getEnvironment());

        log.debug("启动进程: step={}, dir={}", request.getStepPath(), request.getWorkingDirectory());
        Process process = builder.start();
        Set<ProcessHandle> observed = ConcurrentHashMap.newKeySet();
        process.descendants().forEach(observed::add);
        Thread pump = startPump(process, request.getOutput(), request.getStepPath());
        CancellationToken token = request.getCancellationToken();
        try {
            while (!process.waitFor(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(observed::add);
                if (token.isCancelled()) {
                    log.info("步骤被取消，终止进程树: step={}, pid={}, reason={}",
                            request.getStepPath(), process.pid(), token.getReason());
                    terminate(process, observed);
                    return ActionOutcome.failure(CANCELLED_EXIT_CODE, "进程已终止: " + token.getReason());
                }
            }
            return ActionOutcome.exit(process.exitValue());
        } catch (InterruptedException e) {
            log.warn("等待进程时被中断，终止进程树: step={}, pid={}", request.getStepPath(), process.pid());
            terminate(process, observed);
            Thread.currentThread().interrupt();
            throw e;
        } finally {
            reap(process, observed);
            joinPump(pump, process);
        }
    }

    private Thread startPump(Process process, OutputCapture output, String stepPath) {
        Thread pump = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.line(line);
                }
            } catch (IOException e) {
                log.debug("输出流已关闭: step={}, {}", stepPath, e.getMessage());
            }
        }, "step-output-" + process.pid());
        pump.setDaemon(true);
        pump.start();
        return pump;
    }

    private void terminate(Process process, Set<ProcessHandle> observed) {
        process.descendants().forEach(observed::add);
        signalGroup(process, "TERM");
        observed.forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(killGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("进程未在宽限期内退出，强制终止: pid={}", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            signalGroup(process, "KILL");
            observed.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }

    /**
     * 回收仍存活的子孙进程（包括已被父进程遗弃、转为后台的进程）
     */
    private void reap(Process process, Set<ProcessHandle> observed) {
        if (process.isAlive()) {
            terminate(process, observed);
        }
        reapGroup(process);
        observed.stream()
                .filter(ProcessHandle::isAlive)
                .forEach(handle -> {
                    log.info("回收残留子进程: pid={}", handle.pid());
                    handle.destroyForcibly();
                });
    }

    private void reapGroup(Process process) {
        if (!processGroups || !signalGroup(process, "0")) {
            return;
        }
        log.info("回收残留的后台进程组: pgid={}", process.pid());
        signalGroup(process, "TERM");
        long deadline = System.nanoTime() + killGracePeriod.toNanos();
        try {
            while (signalGroup(process, "0")) {
                if (System.nanoTime() >= deadline) {
                    log.warn("进程组未在宽限期内退出，强制终止: pgid={}", process.pid());
                    break;
                }
                TimeUnit.MILLISECONDS.sleep(pollInterval.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            signalGroup(process, "KILL");
        }
    }

    /**
     * 用 shell 内建的 kill 向进程组发送信号，信号 0 只探测组内是否还有进程
     *
     * @return kill 成功（组内至少有一个进程）
     */
    private boolean signalGroup(Process process, String signal) {
        if (!processGroups) {
            return false;
        }
        List<String> argv = new ArrayList<>(shell);
        argv.add("kill -" + signal + " -" + process.pid() + " 2>/dev/null");
        try {
            Process kill = new ProcessBuilder(argv)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!kill.waitFor(killGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                kill.destroyForcibly();
                return false;
            }
            return kill.exitValue() == 0;
        } catch (IOException e) {
            log.warn("向进程组发送信号失败: pgid={}, signal={}, {}", process.pid(), signal, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void joinPump(Thread pump, Process process) {
        try {
            pump.join(killGracePeriod.toMillis());
            if (pump.isAlive()) {
                process.getInputStream().close();
                pump.join(killGracePeriod.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            log.debug("关闭进程输出流失败: pid={}, {}", process.pid(), e.getMessage());
        }
    }
}
