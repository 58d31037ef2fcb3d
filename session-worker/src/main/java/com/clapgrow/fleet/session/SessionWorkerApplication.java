package com.clapgrow.fleet.session;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SessionWorkerApplication {
    public static void main(String[] args) {
        SpringApplication.run(SessionWorkerApplication.class, args);
    }
}
