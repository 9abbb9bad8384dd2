package com.williamcallahan.memorypipeline.config;

import com.williamcallahan.memorypipeline.service.chunking.ChunkerOptions;
import com.williamcallahan.memorypipeline.service.queue.QueueOptions;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pipeline settings exposed as immutable beans, and the clock shared by the stores and the queue.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public QueueOptions queueOptions(AppProperties appProperties) {
        return appProperties.getQueue().toOptions();
    }

    @Bean
    public ChunkerOptions chunkerOptions(AppProperties appProperties) {
        return appProperties.getChunking().toOptions();
    }
}
