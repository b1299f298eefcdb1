package fun.ai.indexer.preview;

import fun.ai.indexer.config.IndexerProperties;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chrome headless；驱动由 Selenium Manager 自动解析
 */
public class SeleniumPageCapturerFactory implements PageCapturerFactory {
    private static final Logger log = LoggerFactory.getLogger(SeleniumPageCapturerFactory.class);

    private final IndexerProperties props;

    public SeleniumPageCapturerFactory(IndexerProperties props) {
        this.props = props;
    }

    @Override
    public PageCapturer create() {
        ChromeOptions options = new ChromeOptions();
        options.addArguments(
                "--headless=new",
                "--window-size=" + props.getScreenshotWidth() + "," + props.getScreenshotHeight(),
                "--no-sandbox",
                "--disable-dev-shm-usage",
                "--disable-gpu",
                "--disable-extensions");
        ChromeDriver driver = new ChromeDriver(options);
        log.info("headless browser started: window={}x{}", props.getScreenshotWidth(), props.getScreenshotHeight());
        return new SeleniumPageCapturer(driver);
    }
}
