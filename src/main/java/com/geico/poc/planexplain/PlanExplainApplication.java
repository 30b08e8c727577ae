package com.geico.poc.planexplain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlanExplainApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanExplainApplication.class, args);
    }
}
