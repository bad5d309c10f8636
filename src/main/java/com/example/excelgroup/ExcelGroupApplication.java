package com.example.excelgroup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ExcelGroupApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExcelGroupApplication.class, args);
    }
}
