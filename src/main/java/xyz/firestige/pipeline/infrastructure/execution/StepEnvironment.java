package xyz.firestige.pipeline.infrastructure.execution;

import xyz.firestige.pipeline.domain.run.CancellationToken;
import xyz.firestige.pipeline.domain.run.RunContext;
import xyz.firestige.pipeline.infrastructure.credential.SecretMasker;

import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * 单次步骤执行所需的环境：运行上下文、作用域内的环境变量与遮蔽器、取消令牌、并发许可
 */
public final class StepEnvironment {

    private final RunContext runContext;
    private final Map<String, String> environment;
    private final SecretMasker masker;
    private final CancellationToken cancellationToken;
    private final Semaphore concurrencyPermits;
    private final Consumer<String> artifactSink;
    private final int attempt;

    public StepEnvironment(RunContext runContext, Map<String, String> environment, SecretMasker masker,
                           CancellationToken cancellationToken, Semaphore concurrencyPermits,
                           Consumer<String> artifactSink, int attempt) {
        this.runContext = runContext;
        this.environment = environment;
        this.masker = masker;
        this.cancellationToken = cancellationToken;
        this.concurrencyPermits = concurrencyPermits;
        this.artifactSink = artifactSink;
        this.attempt = attempt;
    }

    public StepEnvironment withAttempt(int attempt) {
        return new StepEnvironment(runContext, environment, masker, cancellationToken,
                concurrencyPermits, artifactSink, attempt);
    }

    public RunContext getRunContext() {
        return runContext;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public SecretMasker getMasker() {
        return masker;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public Semaphore getConcurrencyPermits() {
        return concurrencyPermits;
    }

    public Consumer<String> getArtifactSink() {
        return artifactSink;
    }

    public int getAttempt() {
        return attempt;
    }
}
