package com.example.roomtodobot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoomTodoBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoomTodoBotApplication.class, args);
    }
}
