package com.nei10u.cosmic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CosmicApplication {

    public static void main(String[] args) {
        SpringApplication.run(CosmicApplication.class, args);
    }
}
