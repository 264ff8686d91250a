package com.convolab.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConvolabServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConvolabServerApplication.class, args);
    }
}
