package fun.ai.indexer.preview;

import java.nio.file.Path;

/**
 * 无头浏览器会话；一个预览批次共用一个实例
 */
public interface PageCapturer extends AutoCloseable {

    void open(String url);

    String title();

    void saveScreenshot(Path target);

    @Override
    void close();
}
