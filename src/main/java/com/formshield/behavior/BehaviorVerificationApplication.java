package com.formshield.behavior;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BehaviorVerificationApplication {

    public static void main(String[] args) {
        SpringApplication.run(BehaviorVerificationApplication.class, args);
    }
}
