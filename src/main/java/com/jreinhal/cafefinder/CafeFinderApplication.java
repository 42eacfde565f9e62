package com.jreinhal.cafefinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CafeFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CafeFinderApplication.class, args);
    }
}
