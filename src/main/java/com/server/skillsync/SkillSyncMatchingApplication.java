package com.server.skillsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkillSyncMatchingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillSyncMatchingApplication.class, args);
    }
}
