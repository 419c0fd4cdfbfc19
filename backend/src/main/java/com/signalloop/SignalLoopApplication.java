package com.signalloop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SignalLoopApplication {
    public static void main(String[] args) {
        SpringApplication.run(SignalLoopApplication.class, args);
    }
}
