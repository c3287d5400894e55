package de.zeiterfassung.api_gleitzeit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApiGleitzeitApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiGleitzeitApplication.class, args);
    }
}
