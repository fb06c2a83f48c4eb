package com.khaounen.botguard.config;

/**
 * Raised while the application context starts when the bot-guard configuration
 * cannot be turned into a usable settings baseline or ruleset.
 */
public class BotGuardConfigurationException extends RuntimeException {

    public BotGuardConfigurationException(String message) {
        super(message);
    }

    public BotGuardConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
