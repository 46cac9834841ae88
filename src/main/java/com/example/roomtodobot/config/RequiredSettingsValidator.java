package com.example.roomtodobot.config;

import com.example.roomtodobot.exception.ConfigurationException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.config.ConfigDataEnvironmentPostProcessor;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;

import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup before any bean is created when the bot token or the store url is missing.
 * Registered in META-INF/spring.factories, ordered after application.properties is loaded.
 */
public class RequiredSettingsValidator implements EnvironmentPostProcessor, Ordered {

    static final String[] REQUIRED_PROPERTIES = {
            "bot.token",
            "spring.datasource.url"
    };

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        List<String> missing = new ArrayList<>();
        for (String property : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(property);
            if (value == null || value.isBlank()) {
                missing.add(property);
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required settings: " + String.join(", ", missing)
                    + " (set TELEGRAM_BOT_TOKEN and DATABASE_URL)");
        }
    }

    @Override
    public int getOrder() {
        return ConfigDataEnvironmentPostProcessor.ORDER + 1;
    }
}
