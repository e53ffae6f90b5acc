package com.example.reportsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReportSyncServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportSyncServiceApplication.class, args);
    }
}
