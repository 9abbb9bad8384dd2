package com.williamcallahan.memorypipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MemoryPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryPipelineApplication.class, args);
    }

}
