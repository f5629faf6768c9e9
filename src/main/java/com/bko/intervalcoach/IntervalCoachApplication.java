package com.bko.intervalcoach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntervalCoachApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntervalCoachApplication.class, args);
    }
}
