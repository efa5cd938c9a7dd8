package com.mathide;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MathIdeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathIdeApplication.class, args);
    }
}
