package com.surveyaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SurveyAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(SurveyAuditApplication.class, args);
    }
}
