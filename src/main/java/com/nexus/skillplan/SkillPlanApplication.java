package com.nexus.skillplan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SkillPlanApplication {
    public static void main(String[] args) {
        SpringApplication.run(SkillPlanApplication.class, args);
    }
}
