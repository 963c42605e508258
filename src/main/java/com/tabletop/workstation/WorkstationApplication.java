package com.tabletop.workstation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WorkstationApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkstationApplication.class, args);
    }
}
