package com.rtmbot.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * rtmbot application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.rtmbot.app")
public class RtmBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(RtmBotApplication.class, args);
    }
}
