package com.instorm.scorecard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScorecardClientApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScorecardClientApplication.class, args);
    }
}
