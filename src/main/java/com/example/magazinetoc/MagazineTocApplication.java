package com.example.magazinetoc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MagazineTocApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MagazineTocApplication.class, args)));
    }
}
