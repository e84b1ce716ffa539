package com.chainwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainwatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainwatchApplication.class, args);
    }
}
