package com.example.anttrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AntTrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(AntTrackApplication.class, args);
    }
}
