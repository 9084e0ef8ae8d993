package xyz.firestige.pipeline.infrastructure.execution.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;
import xyz.firestige.pipeline.infrastructure.credential.SecretMasker;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 步骤输出捕获
 * <p>
 * 每一行先经过遮蔽再落盘，密文不会进入日志文件；同时保留最后若干行用于失败消息。
 * 关闭后到达的行只计数，不落盘也不记录内容（此时凭据作用域可能已清除遮蔽词）。
 */
public class OutputCapture implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OutputCapture.class);

    private static final int TAIL_LINES = 20;

    private final Path file;
    private final String reference;
    private final SecretMasker masker;
    private final BufferedWriter writer;
    private final Deque<String> tail = new ArrayDeque<>();
    private boolean closed;
    private long droppedLines;

    private OutputCapture(Path file, String reference, SecretMasker masker, BufferedWriter writer) {
        this.file = file;
        this.reference = reference;
        this.masker = masker;
        this.writer = writer;
    }

    /**
     * @param runDirectory 运行归档目录
     * @param relative     相对运行目录的日志路径，同时作为输出引用
     */
    public static OutputCapture open(Path runDirectory, String relative, SecretMasker masker) {
        Path file = runDirectory.resolve(relative);
        try {
            Files.createDirectories(file.getParent());
            BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
            return new OutputCapture(file, relative, masker, writer);
        } catch (IOException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "无法创建步骤日志: " + file, e);
        }
    }

    public synchronized void line(String text) {
        if (closed) {
            droppedLines++;
            log.debug("输出已关闭，丢弃迟到的输出行: {} (累计 {})", reference, droppedLines);
            return;
        }
        String masked = masker.mask(text);
        try {
            writer.write(masked);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "写入步骤日志失败: " + file, e);
        }
        tail.addLast(masked);
        if (tail.size() > TAIL_LINES) {
            tail.removeFirst();
        }
        log.debug("| {}", masked);
    }

    public synchronized List<String> tail() {
        return new ArrayList<>(tail);
    }

    public synchronized long getDroppedLines() {
        return droppedLines;
    }

    public String getReference() {
        return reference;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "关闭步骤日志失败: " + file, e);
        }
    }
}
