package com.example.rublimp.generator;

/**
 * Exception thrown when the generator cannot read its inputs or resources.
 */
public class GenerationException extends RuntimeException {
    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
