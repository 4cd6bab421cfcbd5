package com.docsort.fileprocess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FileProcessApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileProcessApplication.class, args);
    }
}
