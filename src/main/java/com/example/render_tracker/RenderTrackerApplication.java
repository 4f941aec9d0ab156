package com.example.render_tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RenderTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RenderTrackerApplication.class, args);
    }

}
