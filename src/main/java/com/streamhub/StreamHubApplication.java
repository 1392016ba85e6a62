package com.streamhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StreamHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamHubApplication.class, args);
    }
}
