package com.document.intelligence;

import com.document.intelligence.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class DocumentIntelligenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumentIntelligenceApplication.class, args);
    }
}
