package com.bastion.crypto;

/**
 * Thrown when a working key cannot be derived from the configured secret.
 * <p>
 * A missing or unusable secret is a deployment error; the process refuses to start rather
 * than run with encryption silently off.
 */
public class KeyDerivationException extends RuntimeException {

    public KeyDerivationException(String message) {
        super(message);
    }

    public KeyDerivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
