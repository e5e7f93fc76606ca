package com.lyz.trainplan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class TrainPlanApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrainPlanApplication.class, args);
    }
}
