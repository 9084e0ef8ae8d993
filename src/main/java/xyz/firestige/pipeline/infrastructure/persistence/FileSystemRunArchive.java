package xyz.firestige.pipeline.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;
import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;
import xyz.firestige.pipeline.domain.shared.vo.RunId;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 文件系统运行归档
 * <p>
 * 报告先写临时文件再原子替换。只有写出报告的运行才参与保留策略，进行中的运行不会被清理。
 */
public class FileSystemRunArchive implements RunArchive {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRunArchive.class);

    public static final String REPORT_FILE = "report.json";

    private final Path root;
    private final ObjectMapper objectMapper;
    private final Map<String, Integer> lastAllocated = new ConcurrentHashMap<>();

    public FileSystemRunArchive(Path root) {
        this.root = root;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized int nextRunNumber(String pipelineName) {
        int onDisk = allRunNumbers(pipelineName).stream().mapToInt(Integer::intValue).max().orElse(0);
        int next = Math.max(onDisk, lastAllocated.getOrDefault(pipelineName, 0)) + 1;
        lastAllocated.put(pipelineName, next);
        return next;
    }

    @Override
    public Path runDirectory(RunId runId) {
        Path dir = root.resolve(runId.getPipelineName()).resolve(String.valueOf(runId.getRunNumber()));
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "无法创建运行目录: " + dir, e);
        }
        return dir;
    }

    @Override
    public void save(RunReport report) {
        Path dir = runDirectory(report.getRunId());
        Path target = dir.resolve(REPORT_FILE);
        Path temp = dir.resolve(REPORT_FILE + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), report);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("运行报告已归档: {}", target);
        } catch (IOException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "写入运行报告失败: " + target, e);
        }
    }

    @Override
    public Optional<RunReport> find(RunId runId) {
        Path file = root.resolve(runId.getPipelineName())
                .resolve(String.valueOf(runId.getRunNumber()))
                .resolve(REPORT_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), RunReport.class));
        } catch (IOException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "读取运行报告失败: " + file, e);
        }
    }

    @Override
    public List<Integer> listRunNumbers(String pipelineName) {
        Path pipelineDir = root.resolve(pipelineName);
        return allRunNumbers(pipelineName).stream()
                .filter(n -> Files.isRegularFile(pipelineDir.resolve(String.valueOf(n)).resolve(REPORT_FILE)))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<RunId> purgeBeyond(String pipelineName, int keep) {
        List<Integer> archived = listRunNumbers(pipelineName);
        List<RunId> purged = new ArrayList<>();
        int excess = archived.size() - keep;
        for (int i = 0; i < excess; i++) {
            RunId runId = RunId.of(pipelineName, archived.get(i));
            Path dir = root.resolve(pipelineName).resolve(String.valueOf(runId.getRunNumber()));
            try {
                FileSystemUtils.deleteRecursively(dir);
                purged.add(runId);
            } catch (IOException e) {
                throw new PipelineException(ErrorType.SYSTEM_ERROR, "清理过期运行失败: " + dir, e);
            }
        }
        if (!purged.isEmpty()) {
            log.info("按保留策略清理运行: pipeline={}, keep={}, purged={}", pipelineName, keep, purged);
        }
        return purged;
    }

    private List<Integer> allRunNumbers(String pipelineName) {
        Path pipelineDir = root.resolve(pipelineName);
        if (!Files.isDirectory(pipelineDir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(pipelineDir)) {
            return children.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.matches("\\d+"))
                    .map(Integer::valueOf)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "无法列出运行目录: " + pipelineDir, e);
        }
    }

    public Path getRoot() {
        return root;
    }
}
