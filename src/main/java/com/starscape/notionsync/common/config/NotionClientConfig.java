package com.starscape.notionsync.common.config;

import com.starscape.notionsync.common.http.NotionTransport;
import com.starscape.notionsync.common.http.RestClientNotionTransport;
import com.starscape.notionsync.features.fileupload.app.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotionClientConfig {
    
    @Bean(destroyMethod = "close")
    public NotionTransport notionTransport(NotionProperties properties) {
        return new RestClientNotionTransport(properties);
    }
    
    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
