package com.example.mosaicgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MosaicGeneratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MosaicGeneratorApplication.class, args);
    }
}
