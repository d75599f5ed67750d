package com.decisiontrace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DecisionTraceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DecisionTraceApplication.class, args);
    }
}
