package com.careu.reasoning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CareuReasoningApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareuReasoningApplication.class, args);
    }
}
