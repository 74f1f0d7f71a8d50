package com.reqminer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReqMinerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReqMinerApplication.class, args);
    }
}
