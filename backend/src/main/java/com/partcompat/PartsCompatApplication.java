package com.partcompat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PartsCompatApplication {

    public static void main(String[] args) {
        SpringApplication.run(PartsCompatApplication.class, args);
    }
}
