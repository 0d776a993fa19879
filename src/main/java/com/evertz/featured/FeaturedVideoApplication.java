package com.evertz.featured;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FeaturedVideoApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeaturedVideoApplication.class, args);
    }
}
