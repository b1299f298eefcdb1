package fun.ai.indexer.scan;

import fun.ai.indexer.config.IndexerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 判断一个源文件是不是 "可启动的 web 小应用"
 * - 必须包含 app.run(
 * - 有 def main(): 但没有 main guard 的视为工具脚本，排除
 * - 端口取 app.run(... port=NNNN)，否则用默认端口
 */
@Component
public class AppCandidateDetector {
    private static final Logger log = LoggerFactory.getLogger(AppCandidateDetector.class);

    private static final Pattern SERVER_START = Pattern.compile("app\\.run\\(");
    private static final Pattern DECLARED_PORT = Pattern.compile("app\\.run\\(.*?port\\s*=\\s*(\\d+)");
    private static final String MAIN_DEF = "def main():";
    private static final List<String> MAIN_GUARDS = Arrays.asList(
            "if __name__ == \"__main__\":",
            "if __name__ == '__main__':");

    static final List<String> COMPANION_CANDIDATES = Arrays.asList(
            "index.html",
            "templates/index.html",
            "static/index.html",
            "public/index.html",
            "frontend/index.html");

    private final IndexerProperties props;
    private final FolderWalker walker;

    public AppCandidateDetector(IndexerProperties props, FolderWalker walker) {
        this.props = props;
        this.walker = walker;
    }

    /**
     * @return 不含配套页面的描述；不是 web 应用时返回 empty
     */
    public Optional<AppDescriptor> detect(Path source) {
        String content;
        try {
            // 非法 UTF-8 字节按替换字符处理
            content = new String(Files.readAllBytes(source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("read source failed: path={}, error={}", source, e.getMessage());
            return Optional.empty();
        }
        return detect(source, content);
    }

    Optional<AppDescriptor> detect(Path source, String content) {
        if (content == null || !SERVER_START.matcher(content).find()) {
            return Optional.empty();
        }
        if (content.contains(MAIN_DEF) && MAIN_GUARDS.stream().noneMatch(content::contains)) {
            return Optional.empty();
        }
        int port = props.getDefaultPort();
        Matcher m = DECLARED_PORT.matcher(content);
        if (m.find()) {
            try {
                port = Integer.parseInt(m.group(1));
            } catch (NumberFormatException ignore) {
                // 超出 int 范围，沿用默认端口
            }
        }
        return Optional.of(AppDescriptor.executable(displayName(source), source, null, port, guessFramework(content)));
    }

    String guessFramework(String content) {
        if (content.contains("from flask") || content.contains("import flask")) return "flask";
        if (content.contains("from django") || content.contains("import django")) return "django";
        return "unknown";
    }

    /**
     * 应用目录树中的第一个页面文件（排序后），找不到再尝试常见位置
     */
    public Optional<Path> findCompanionPage(Path appDir) {
        List<Path> pages = walker.walk(appDir, props.getPageExtension());
        if (!pages.isEmpty()) {
            return Optional.of(pages.get(0));
        }
        for (String candidate : COMPANION_CANDIDATES) {
            Path p = appDir.resolve(candidate);
            if (Files.isRegularFile(p)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /**
     * my_cool_app.py -> My Cool App
     */
    public static String displayName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return Arrays.stream(stem.replace('_', ' ').split(" ", -1))
                .map(AppCandidateDetector::titleWord)
                .collect(Collectors.joining(" "));
    }

    private static String titleWord(String w) {
        if (w.isEmpty()) return w;
        StringBuilder sb = new StringBuilder(w.length());
        boolean start = true;
        for (char c : w.toLowerCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(start ? Character.toUpperCase(c) : c);
                start = false;
            } else {
                sb.append(c);
                start = true;
            }
        }
        return sb.toString();
    }
}
