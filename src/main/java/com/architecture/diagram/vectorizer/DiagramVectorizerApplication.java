package com.architecture.diagram.vectorizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiagramVectorizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiagramVectorizerApplication.class, args);
    }
}
