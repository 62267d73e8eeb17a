package com.familygraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FamilyGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(FamilyGraphApplication.class, args);
    }
}
