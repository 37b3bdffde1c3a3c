package com.dataops.costanomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CostAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAnomalyApplication.class, args);
    }
}
