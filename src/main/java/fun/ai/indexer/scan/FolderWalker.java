package fun.ai.indexer.scan;

import fun.ai.indexer.config.IndexerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 递归列出某扩展名的文件（跳过依赖目录/虚拟环境），结果按路径排序
 */
@Component
public class FolderWalker {
    private static final Logger log = LoggerFactory.getLogger(FolderWalker.class);

    private final IndexerProperties props;

    public FolderWalker(IndexerProperties props) {
        this.props = props;
    }

    public List<Path> walk(Path root, String extension) {
        if (root == null || !Files.isDirectory(root)) {
            return Collections.emptyList();
        }
        String ext = extension.toLowerCase(Locale.ROOT);
        Set<String> excluded = new HashSet<>(props.getExcludedDirs() == null ? List.of() : props.getExcludedDirs());
        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    Path name = dir.getFileName();
                    if (!dir.equals(root) && name != null && excluded.contains(name.toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(ext)) {
                        found.add(file.toAbsolutePath().normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("skip unreadable path: path={}, error={}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("walk folder failed: root={}, error={}", root, e.getMessage());
        }
        Collections.sort(found);
        return found;
    }
}
