package com.studyprep.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.studyprep")
@EnableScheduling
public class StudyPrepApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudyPrepApiApplication.class, args);
    }
}
