package com.example.docxstructure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocxStructureApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocxStructureApplication.class, args);
    }

}
