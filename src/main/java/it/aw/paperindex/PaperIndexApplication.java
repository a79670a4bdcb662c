package it.aw.paperindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaperIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaperIndexApplication.class, args);
    }
}
