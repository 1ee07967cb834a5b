package com.example.tablecompare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TableCompareApplication {
    public static void main(String[] args) {
        SpringApplication.run(TableCompareApplication.class, args);
    }
}
