package com.example.handoff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatHandoffApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatHandoffApplication.class, args);
    }
}
