package fun.ai.indexer.preview;

import fun.ai.indexer.exception.CaptureException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class SeleniumPageCapturer implements PageCapturer {
    private static final Logger log = LoggerFactory.getLogger(SeleniumPageCapturer.class);

    private final WebDriver driver;

    public SeleniumPageCapturer(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public void open(String url) {
        driver.get(url);
    }

    @Override
    public String title() {
        return driver.getTitle();
    }

    @Override
    public void saveScreenshot(Path target) {
        byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, png);
        } catch (IOException e) {
            throw new CaptureException("write screenshot failed: " + target + ", error=" + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (Exception e) {
            log.warn("quit browser failed: {}", e.getMessage());
        }
    }
}
