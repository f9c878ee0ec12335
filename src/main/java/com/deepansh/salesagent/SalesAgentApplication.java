package com.deepansh.salesagent;

import com.deepansh.salesagent.config.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties(EngineProperties.class)
public class SalesAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(SalesAgentApplication.class, args);
    }
}
