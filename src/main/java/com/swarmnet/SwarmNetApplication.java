package com.swarmnet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwarmNetApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwarmNetApplication.class, args);
    }
}
