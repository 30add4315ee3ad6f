package com.signalarena.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.signalarena")
public class SignalArenaApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalArenaApplication.class, args);
    }
}
