package com.commutewise.commute_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CommuteEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommuteEngineApplication.class, args);
    }
}
