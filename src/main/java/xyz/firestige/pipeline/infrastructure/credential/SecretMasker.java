package xyz.firestige.pipeline.infrastructure.credential;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.stream.Collectors;

/**
 * 密文遮蔽：把已登记的密文替换为 {@code ****}
 * <p>
 * 多行密文按整体和逐行分别登记，逐行输出时同样能被遮蔽。较长的密文优先替换。
 */
public class SecretMasker {

    public static final String MASK = "****";

    private final Set<String> secrets = new CopyOnWriteArraySet<>();

    public void register(String secret) {
        if (secret == null || secret.isEmpty()) {
            return;
        }
        secrets.add(secret);
        if (secret.contains("\n")) {
            for (String line : secret.split("\\r?\\n")) {
                if (!line.isBlank()) {
                    secrets.add(line);
                }
            }
        }
    }

    public String mask(String text) {
        if (text == null || text.isEmpty() || secrets.isEmpty()) {
            return text;
        }
        List<String> ordered = secrets.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toList());
        String masked = text;
        for (String secret : ordered) {
            masked = masked.replace(secret, MASK);
        }
        return masked;
    }

    public boolean isEmpty() {
        return secrets.isEmpty();
    }

    public void clear() {
        secrets.clear();
    }
}
