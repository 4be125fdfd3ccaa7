package com.example.flowscope.store;

import com.example.flowscope.config.FlowscopeProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TraceStoreConfig {

    @Bean
    public TraceStore traceStore(FlowscopeProperties properties, Clock clock) {
        FlowscopeProperties.Trace t = properties.getTrace();
        return new TraceStore(t.getMaxTraces(), t.isAutoCreateOnUnknownCheckpoint(), t.isRecordStartCheckpoint(), clock);
    }
}
