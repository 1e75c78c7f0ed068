package com.sheetengine.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetEngineApplication.class, args);
    }
}
