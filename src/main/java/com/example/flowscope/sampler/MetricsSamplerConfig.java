package com.example.flowscope.sampler;

import com.example.flowscope.config.FlowscopeProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MetricsSamplerConfig {

    @Bean
    public ProcessResourceProbe processResourceProbe() {
        return new JvmProcessResourceProbe();
    }

    @Bean
    public MetricsSampler metricsSampler(ProcessResourceProbe probe, Clock clock, FlowscopeProperties properties) {
        FlowscopeProperties.Sampler s = properties.getSampler();
        return new MetricsSampler(probe, clock, s.getIntervalMs(), s.getHistorySize(), s.getQueueCapacity());
    }
}
