package com.example.salesmart;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SaleSmartApplication {
    public static void main(String[] args) {
        SpringApplication.run(SaleSmartApplication.class, args);
    }
}
