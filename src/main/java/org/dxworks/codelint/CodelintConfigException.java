package org.dxworks.codelint;

/**
 * Raised while loading configuration: unknown rules, invalid levels or option values.
 */
public class CodelintConfigException extends RuntimeException {

    public CodelintConfigException(String message) {
        super(message);
    }

    public CodelintConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
