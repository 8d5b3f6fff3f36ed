package com.cityhunt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CityHuntApplication {
    public static void main(String[] args) {
        SpringApplication.run(CityHuntApplication.class, args);
    }
}
