package com.example.onetwoone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OneTwoOneApplication {

    public static void main(String[] args) {
        SpringApplication.run(OneTwoOneApplication.class, args);
    }
}
