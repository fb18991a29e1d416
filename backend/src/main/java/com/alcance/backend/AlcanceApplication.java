package com.alcance.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlcanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlcanceApplication.class, args);
    }
}
