package com.leveltrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LevelTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(LevelTraderApplication.class, args);
    }
}
