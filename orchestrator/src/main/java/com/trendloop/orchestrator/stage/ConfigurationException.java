package com.trendloop.orchestrator.stage;

/**
 * Thrown at startup when the stage pipeline is mis-declared: duplicate names or
 * ordinals, a required input no earlier stage produces, or a registration attempted
 * after the registry was sealed.
 *
 * Fatal: never caught and recovered at run time.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
