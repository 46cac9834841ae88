package com.example.roomtodobot.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;

@Component
public class RoomCodeGenerator {

    private final Random random = new SecureRandom();

    /**
     * Random 4-digit code, leading zeros kept
     */
    public String nextCode() {
        return String.format("%04d", random.nextInt(10_000));
    }
}
