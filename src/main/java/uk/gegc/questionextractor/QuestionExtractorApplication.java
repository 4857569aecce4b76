package uk.gegc.questionextractor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuestionExtractorApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuestionExtractorApplication.class, args);
    }
}
