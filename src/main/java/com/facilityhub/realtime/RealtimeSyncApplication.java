package com.facilityhub.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RealtimeSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeSyncApplication.class, args);
    }
}
