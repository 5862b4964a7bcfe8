package com.smartmoneyradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SmartMoneyRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartMoneyRadarApplication.class, args);
    }
}
