package org.surveyworkbench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SurveyWorkbenchApplication {
    public static void main(String[] args) {
        SpringApplication.run(SurveyWorkbenchApplication.class, args);
    }
}
