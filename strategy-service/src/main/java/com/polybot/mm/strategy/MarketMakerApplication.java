package com.polybot.mm.strategy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.polybot.mm")
public class MarketMakerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketMakerApplication.class, args);
    }
}
