package com.workhub.server;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class WorkHubServerApplication {

    public static void main(String[] args) {
        log.info("Starting WorkHub hub server...");
        SpringApplication.run(WorkHubServerApplication.class, args);
        log.info("WorkHub hub server started");
    }
}
