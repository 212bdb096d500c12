package com.deepansh.billbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BillBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(BillBotApplication.class, args);
    }
}
