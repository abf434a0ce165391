package com.hydro.petcmp.registry;

/**
 * Setup-time error: a malformed formula descriptor, a duplicate name, or a
 * configuration option the target formula does not recognize.
 * <p>
 * Raised before any data is processed.
 */
public class RegistrationException extends IllegalArgumentException {

    public RegistrationException(String message) {
        super(message);
    }
}
