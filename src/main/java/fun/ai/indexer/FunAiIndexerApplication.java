package fun.ai.indexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FunAiIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FunAiIndexerApplication.class, args);
    }
}
