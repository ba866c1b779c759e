package com.positionengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PositionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PositionEngineApplication.class, args);
    }
}
