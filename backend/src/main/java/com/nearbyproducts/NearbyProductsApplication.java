package com.nearbyproducts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NearbyProductsApplication {

    public static void main(String[] args) {
        SpringApplication.run(NearbyProductsApplication.class, args);
    }
}
