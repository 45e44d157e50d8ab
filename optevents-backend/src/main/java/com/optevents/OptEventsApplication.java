package com.optevents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptEventsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptEventsApplication.class, args);
    }
}
