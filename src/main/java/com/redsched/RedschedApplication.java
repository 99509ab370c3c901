package com.redsched;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RedschedApplication {

    public static void main(String[] args) {
        SpringApplication.run(RedschedApplication.class, args);
    }
}
