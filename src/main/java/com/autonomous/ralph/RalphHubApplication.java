package com.autonomous.ralph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RalphHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(RalphHubApplication.class, args);
    }
}
