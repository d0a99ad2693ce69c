package com.slotplanner.slotplanner_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SlotplannerApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlotplannerApiApplication.class, args);
    }
}
