package fun.ai.indexer.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.ArrayList;

/**
 * 主文件的元数据：大小、mtime、声明的依赖（import/from 行）
 */
@Component
public class FileMetadataReader {
    private static final Logger log = LoggerFactory.getLogger(FileMetadataReader.class);

    static final Set<String> IGNORED_MODULES = new HashSet<>(Arrays.asList(
            "os", "sys", "json", "time", "datetime", "pathlib"));

    static final String REQUIREMENTS_FILE = "requirements.txt";

    public long size(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0L;
        }
    }

    /**
     * @return epoch ms；读取失败返回 null
     */
    public Long lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            return null;
        }
    }

    public List<String> dependencies(Path source) {
        String content;
        try {
            content = new String(Files.readAllBytes(source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("read dependencies failed: path={}, error={}", source, e.getMessage());
            return new ArrayList<>();
        }
        Set<String> modules = new LinkedHashSet<>();
        for (String raw : content.split("\n")) {
            String line = raw.trim();
            if (!line.startsWith("import ") && !line.startsWith("from ")) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 2) {
                continue;
            }
            String module = parts[1];
            if (line.startsWith("import ")) {
                module = module.split("\\.")[0];
            }
            module = module.replace(",", "");
            if (!module.isEmpty() && !IGNORED_MODULES.contains(module)) {
                modules.add(module);
            }
        }
        return new ArrayList<>(modules);
    }

    /**
     * 依赖是否都能在 requirements.txt 中找到（先找脚本所在目录，再找扫描根目录）。
     * 没有依赖视为齐全；找不到 requirements.txt 视为无法确认（缺失）。
     */
    public boolean hasMissingDependencies(List<String> dependencies, Path appDir, Path scanRoot) {
        if (dependencies == null || dependencies.isEmpty()) {
            return false;
        }
        Set<String> available = readRequirements(appDir.resolve(REQUIREMENTS_FILE));
        if (available.isEmpty() && scanRoot != null) {
            available = readRequirements(scanRoot.resolve(REQUIREMENTS_FILE));
        }
        if (available.isEmpty()) {
            return true;
        }
        for (String dep : dependencies) {
            if (!available.contains(dep.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    Set<String> readRequirements(Path file) {
        Set<String> packages = new HashSet<>();
        if (!Files.isRegularFile(file)) {
            return packages;
        }
        try {
            for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String line = raw.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String name = line.split("\\s+")[0].split("[=<>!~;\\[]")[0];
                if (!name.isEmpty()) {
                    packages.add(name.toLowerCase(Locale.ROOT));
                }
            }
        } catch (IOException e) {
            log.debug("read requirements failed: path={}, error={}", file, e.getMessage());
        }
        return packages;
    }
}
