package com.starscape.notionsync;

import com.starscape.notionsync.common.config.NotionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(NotionProperties.class)
public class NotionSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotionSyncApplication.class, args);
    }
}
