package com.example.datalake.sentiment;

import com.example.datalake.sentiment.config.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(EngineProperties.class)
public class SentimentEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentimentEngineApplication.class, args);
    }

}
