package com.example.rublimp.generator.sentence;

import com.example.rublimp.generator.GenerationException;

/**
 * Raised when a dependency tree violates the single-root, acyclic, in-range head invariant.
 */
public class MalformedSentenceException extends GenerationException {

    private final String sentenceId;

    public MalformedSentenceException(String sentenceId, String message) {
        super("Malformed sentence " + sentenceId + ": " + message);
        this.sentenceId = sentenceId;
    }

    public String sentenceId() {
        return sentenceId;
    }
}
