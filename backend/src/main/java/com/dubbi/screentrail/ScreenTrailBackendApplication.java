package com.dubbi.screentrail;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScreenTrailBackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScreenTrailBackendApplication.class, args);
    }
}
