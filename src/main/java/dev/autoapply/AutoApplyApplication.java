package dev.autoapply;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class AutoApplyApplication {

    public static void main(String[] args) {
        log.info("========================================");
        log.info("Auto-Apply Core Starting");
        log.info("========================================");
        SpringApplication.run(AutoApplyApplication.class, args);
    }
}
