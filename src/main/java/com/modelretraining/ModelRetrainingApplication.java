package com.modelretraining;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModelRetrainingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelRetrainingApplication.class, args);
    }
}
