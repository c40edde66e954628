package com.clauselens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ClauseLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClauseLensApplication.class, args);
    }
}
