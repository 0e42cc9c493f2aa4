package io.github.nicechester.scripture;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScriptureCoreApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(ScriptureCoreApplication.class, args);
    }
}
