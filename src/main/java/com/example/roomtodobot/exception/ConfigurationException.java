package com.example.roomtodobot.exception;

/**
 * Required setting is missing at boot. Fatal: the application does not start.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
