package com.jedi.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JediCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(JediCatalogApplication.class, args);
    }
}
