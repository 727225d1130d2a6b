package com.poolhistory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PoolHistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(PoolHistoryApplication.class, args);
    }
}
