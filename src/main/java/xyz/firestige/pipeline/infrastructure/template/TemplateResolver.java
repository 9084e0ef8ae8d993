package xyz.firestige.pipeline.infrastructure.template;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 命令模板解析器
 * <p>
 * 替换 {@code ${NAME}} 占位符；变量表中没有的占位符原样保留，交给 shell 从环境变量展开。
 * 凭据变量从不进入变量表，因此密文不会被写进命令文本。
 */
public class TemplateResolver {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    public String resolve(String template, Map<String, String> variables) {
        if (template == null || variables == null || variables.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = variables.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group(0);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public Map<String, String> resolveAll(Map<String, String> templates, Map<String, String> variables) {
        Map<String, String> resolved = new LinkedHashMap<>();
        templates.forEach((key, value) -> resolved.put(key, resolve(value, variables)));
        return resolved;
    }
}
