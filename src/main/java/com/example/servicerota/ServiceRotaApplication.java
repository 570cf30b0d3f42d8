package com.example.servicerota;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ServiceRotaApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServiceRotaApplication.class, args);
    }
}
