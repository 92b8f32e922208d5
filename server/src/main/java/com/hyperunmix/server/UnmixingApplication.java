package com.hyperunmix.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UnmixingApplication {

    public static void main(String[] args) {
        SpringApplication.run(UnmixingApplication.class, args);
    }
}
