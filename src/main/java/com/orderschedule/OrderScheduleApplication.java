package com.orderschedule;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrderScheduleApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderScheduleApplication.class, args);
    }
}
