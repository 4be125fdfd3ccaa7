package com.example.flowscope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowscopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowscopeApplication.class, args);
    }
}
