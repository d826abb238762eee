package com.statassist.rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RagApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(RagApiApplication.class, args);
    }
}
