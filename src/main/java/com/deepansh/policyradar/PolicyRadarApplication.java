package com.deepansh.policyradar;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({RadarProperties.class, LlmProperties.class})
public class PolicyRadarApplication {
    public static void main(String[] args) {
        SpringApplication.run(PolicyRadarApplication.class, args);
    }
}
