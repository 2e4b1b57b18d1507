package com.fleet.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProcessAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProcessAnomalyApplication.class, args);
    }
}
