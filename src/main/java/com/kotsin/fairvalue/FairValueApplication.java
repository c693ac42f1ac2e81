package com.kotsin.fairvalue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot Application exposing the psychological fair value engine over REST.
 */
@SpringBootApplication
public class FairValueApplication {

    public static void main(String[] args) {
        SpringApplication.run(FairValueApplication.class, args);
    }
}
