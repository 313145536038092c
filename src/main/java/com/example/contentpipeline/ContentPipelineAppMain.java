package com.example.contentpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Runs the worker role (pipeline.worker.enabled) and the REST client role in one process.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ContentPipelineAppMain {

    public static void main(String[] args) {
        SpringApplication.run(ContentPipelineAppMain.class, args);
    }
}
