package com.example.barshift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BarShiftApplication {

    public static void main(String[] args) {
        SpringApplication.run(BarShiftApplication.class, args);
    }
}
