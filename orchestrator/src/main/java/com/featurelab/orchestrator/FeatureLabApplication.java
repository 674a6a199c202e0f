package com.featurelab.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeatureLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeatureLabApplication.class, args);
    }
}
