package xyz.firestige.pipeline.infrastructure.execution.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 归档产物（{@code archiveArtifacts}）
 * <p>
 * 参数：{@code artifacts} 逗号分隔的 glob（相对工作区），{@code allowEmpty} 没有匹配时是否仍算成功。
 * 匹配的文件保留相对路径复制到运行归档的 {@code artifacts/} 目录。
 */
public class ArchiveArtifactsAction implements StepAction {

    public static final String ACTION_ID = "archiveArtifacts";

    private static final Logger log = LoggerFactory.getLogger(ArchiveArtifactsAction.class);

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionOutcome invoke(ActionRequest request) throws IOException {
        String patterns = request.getArgument("artifacts", null);
        if (patterns == null || patterns.isBlank()) {
            return ActionOutcome.failure(2, "archiveArtifacts 缺少参数 artifacts");
        }
        boolean allowEmpty = Boolean.parseBoolean(request.getArgument("allowEmpty", "false"));

        Path workspace = request.getRunContext().getWorkspace();
        Path target = request.getRunContext().getArtifactDirectory();
        Path runDirectory = request.getRunContext().getRunDirectory();

        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns.split(",")) {
            if (!pattern.isBlank()) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern.trim()));
            }
        }

        List<Path> matched;
        try (Stream<Path> files = Files.walk(workspace)) {
            matched = files.filter(Files::isRegularFile)
                    .filter(file -> {
                        Path relative = workspace.relativize(file);
                        return matchers.stream().anyMatch(m -> m.matches(relative));
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }

        if (matched.isEmpty()) {
            request.getOutput().line("没有匹配的产物: " + patterns);
            return allowEmpty ? ActionOutcome.success() : ActionOutcome.failure(1, "没有匹配的产物: " + patterns);
        }

        List<String> archived = new ArrayList<>();
        for (Path file : matched) {
            if (request.getCancellationToken().isCancelled()) {
                return ActionOutcome.failure(ShellCommandAction.CANCELLED_EXIT_CODE, "归档被取消");
            }
            Path destination = target.resolve(workspace.relativize(file).toString());
            Files.createDirectories(destination.getParent());
            Files.copy(file, destination, StandardCopyOption.REPLACE_EXISTING);
            String reference = runDirectory.relativize(destination).toString().replace('\\', '/');
            archived.add(reference);
            request.getOutput().line("已归档: " + reference);
        }
        log.info("归档产物 {} 个: step={}", archived.size(), request.getStepPath());
        return ActionOutcome.success(archived);
    }
}
