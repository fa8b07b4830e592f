package com.example.rublimp.generator.phenomena;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A structural match: the token to perturb, optionally the token it agrees with or is governed
 * by, and optionally an intervening attractor. Positions are 1-based; 0 means absent.
 */
public final class Candidate {

    private final String phenomenonId;
    private final int target;
    private final int controller;
    private final int attractor;
    private final String subtype;
    private final Map<String, String> details;

    private Candidate(Builder builder) {
        this.phenomenonId = Objects.requireNonNull(builder.phenomenonId, "phenomenonId");
        this.target = builder.target;
        this.controller = builder.controller;
        this.attractor = builder.attractor;
        this.subtype = builder.subtype != null ? builder.subtype : builder.phenomenonId;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    public static Builder builder(String phenomenonId, int target) {
        return new Builder(phenomenonId, target);
    }

    public String phenomenonId() {
        return phenomenonId;
    }

    public int target() {
        return target;
    }

    public int controller() {
        return controller;
    }

    public boolean hasController() {
        return controller > 0;
    }

    public int attractor() {
        return attractor;
    }

    public boolean hasAttractor() {
        return attractor > 0;
    }

    public String subtype() {
        return subtype;
    }

    public Map<String, String> details() {
        return details;
    }

    public String detail(String key) {
        return details.get(key);
    }

    @Override
    public String toString() {
        return phenomenonId + "[target=" + target + ", controller=" + controller
                + ", attractor=" + attractor + ", subtype=" + subtype + ", details=" + details + "]";
    }

    public static final class Builder {
        private final String phenomenonId;
        private final int target;
        private int controller;
        private int attractor;
        private String subtype;
        private final Map<String, String> details = new LinkedHashMap<>();

        private Builder(String phenomenonId, int target) {
            this.phenomenonId = phenomenonId;
            this.target = target;
        }

        public Builder controller(int controller) {
            this.controller = controller;
            return this;
        }

        public Builder attractor(int attractor) {
            this.attractor = attractor;
            return this;
        }

        public Builder subtype(String subtype) {
            this.subtype = subtype;
            return this;
        }

        public Builder detail(String key, String value) {
            details.put(key, value);
            return this;
        }

        public Candidate build() {
            return new Candidate(this);
        }
    }
}
