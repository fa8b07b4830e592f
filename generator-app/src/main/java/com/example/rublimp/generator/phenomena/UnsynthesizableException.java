package com.example.rublimp.generator.phenomena;

/**
 * Signals that a rule cannot produce a valid form for one alternative value. The engine drops
 * that value and carries on with the next one.
 */
public class UnsynthesizableException extends Exception {

    public UnsynthesizableException(String message) {
        super(message);
    }
}
