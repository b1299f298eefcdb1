package fun.ai.indexer.scan;

import fun.ai.indexer.config.IndexerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 发现任务的前两个阶段：找可执行应用、找独立页面
 */
@Component
public class FolderScanner {
    private static final Logger log = LoggerFactory.getLogger(FolderScanner.class);

    private final AppCandidateDetector detector;
    private final FolderWalker walker;
    private final IndexerProperties props;

    public FolderScanner(AppCandidateDetector detector, FolderWalker walker, IndexerProperties props) {
        this.detector = detector;
        this.walker = walker;
        this.props = props;
    }

    public List<AppDescriptor> findExecutables(Path root) {
        List<AppDescriptor> apps = new ArrayList<>();
        for (Path source : walker.walk(root, props.getExecutableExtension())) {
            Optional<AppDescriptor> candidate = detector.detect(source);
            if (candidate.isEmpty()) {
                continue;
            }
            Optional<Path> page = detector.findCompanionPage(source.getParent());
            if (page.isEmpty()) {
                log.warn("no companion page found, skip app: path={}", source);
                continue;
            }
            apps.add(candidate.get().withInterface(page.get()));
        }
        log.info("executables found: root={}, count={}", root, apps.size());
        return apps;
    }

    /**
     * 页面文件中去掉已被可执行应用认领为配套页面的部分
     */
    public List<AppDescriptor> findStatic(Path root, Collection<AppDescriptor> executables) {
        Set<Path> claimed = new HashSet<>();
        if (executables != null) {
            for (AppDescriptor app : executables) {
                if (app.getInterfaceFile() != null) {
                    claimed.add(app.getInterfaceFile().toAbsolutePath().normalize());
                }
            }
        }
        List<AppDescriptor> pages = new ArrayList<>();
        for (Path page : walker.walk(root, props.getPageExtension())) {
            if (claimed.contains(page)) {
                continue;
            }
            pages.add(AppDescriptor.page(AppCandidateDetector.displayName(page), page));
        }
        log.info("standalone pages found: root={}, count={}, claimed={}", root, pages.size(), claimed.size());
        return pages;
    }
}
