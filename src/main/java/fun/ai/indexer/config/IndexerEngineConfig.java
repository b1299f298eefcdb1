package fun.ai.indexer.config;

import fun.ai.indexer.launcher.Pause;
import fun.ai.indexer.preview.PageCapturerFactory;
import fun.ai.indexer.preview.SeleniumPageCapturerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 编排核心的可替换部件：固定等待、无头浏览器、live 请求的后台执行线程
 */
@Configuration
public class IndexerEngineConfig {

    @Bean
    public Pause pause() {
        return Pause.threadSleep();
    }

    @Bean
    public PageCapturerFactory pageCapturerFactory(IndexerProperties props) {
        return new SeleniumPageCapturerFactory(props);
    }

    /**
     * launch 需要等待 settle delay，放到这里执行，不占用请求线程
     */
    @Bean(name = "liveExecutor")
    public ThreadPoolTaskExecutor liveExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(32);
        executor.setThreadNamePrefix("live-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
