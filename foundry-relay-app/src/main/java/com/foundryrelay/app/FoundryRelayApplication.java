package com.foundryrelay.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Foundry relay server entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.foundryrelay")
public class FoundryRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(FoundryRelayApplication.class, args);
    }
}
