package com.contenttracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentTrackerApplication.class, args);
    }
}
