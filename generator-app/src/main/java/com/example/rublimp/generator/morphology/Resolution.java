package com.example.rublimp.generator.morphology;

import java.util.Objects;

/**
 * Outcome of matching a token against its analyzer readings: either one chosen reading or a
 * reason why none could be trusted.
 */
public abstract class Resolution {

    private Resolution() {
    }

    public static Resolution resolved(Analysis analysis) {
        return new Resolved(analysis);
    }

    public static Resolution unresolved(String reason) {
        return new Unresolved(reason);
    }

    public abstract boolean isResolved();

    /**
     * @throws IllegalStateException when unresolved
     */
    public abstract Analysis analysis();

    public abstract String reason();

    public static final class Resolved extends Resolution {

        private final Analysis analysis;

        private Resolved(Analysis analysis) {
            this.analysis = Objects.requireNonNull(analysis, "analysis");
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public Analysis analysis() {
            return analysis;
        }

        @Override
        public String reason() {
            return "";
        }

        @Override
        public String toString() {
            return "Resolved[" + analysis + "]";
        }
    }

    public static final class Unresolved extends Resolution {

        private final String reason;

        private Unresolved(String reason) {
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public Analysis analysis() {
            throw new IllegalStateException("Unresolved: " + reason);
        }

        @Override
        public String reason() {
            return reason;
        }

        @Override
        public String toString() {
            return "Unresolved[" + reason + "]";
        }
    }
}
