package ru.tigran.nationalityengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NationalityEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(NationalityEngineApplication.class, args);
    }
}
