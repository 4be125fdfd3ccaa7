package com.example.flowscope.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(FlowscopeProperties.class)
public class FlowscopeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
