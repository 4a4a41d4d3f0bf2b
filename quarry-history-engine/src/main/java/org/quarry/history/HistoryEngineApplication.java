package org.quarry.history;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HistoryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(HistoryEngineApplication.class, args);
    }
}
