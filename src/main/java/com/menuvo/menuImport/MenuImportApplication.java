package com.menuvo.menuImport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MenuImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(MenuImportApplication.class, args);
    }
}
