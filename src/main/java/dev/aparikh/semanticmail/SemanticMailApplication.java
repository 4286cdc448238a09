package dev.aparikh.semanticmail;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SemanticMailApplication {

    public static void main(String[] args) {
        SpringApplication.run(SemanticMailApplication.class, args);
    }
}
