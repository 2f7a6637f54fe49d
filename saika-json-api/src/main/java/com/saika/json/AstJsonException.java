package com.saika.json;

/**
 * Unchecked failure while converting a syntax tree or a dialect to or from JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
