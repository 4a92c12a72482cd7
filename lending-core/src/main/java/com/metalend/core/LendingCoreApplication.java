package com.metalend.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LendingCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendingCoreApplication.class, args);
    }
}
