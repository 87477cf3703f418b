package com.example.residency_scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResidencySchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResidencySchedulerApplication.class, args);
    }
}
