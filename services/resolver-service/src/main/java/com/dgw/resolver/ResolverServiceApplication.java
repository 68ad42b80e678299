package com.dgw.resolver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResolverServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ResolverServiceApplication.class, args);
    }
}
