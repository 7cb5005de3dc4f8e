package com.example.wizardchess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WizardChessApplication {

    public static void main(String[] args) {
        SpringApplication.run(WizardChessApplication.class, args);
    }
}
