package com.example.reportcard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReportCardServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportCardServerApplication.class, args);
    }

}
