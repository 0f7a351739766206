package com.muzee;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MuzeeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MuzeeApplication.class, args);
    }
}
