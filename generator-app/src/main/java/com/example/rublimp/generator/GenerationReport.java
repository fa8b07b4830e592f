package com.example.rublimp.generator;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts what happened to the candidates of a run: how many were found, accepted, and dropped for
 * each reason. Safe to share between workers.
 */
public final class GenerationReport {

    public static final String SENTENCES = "sentences";
    public static final String CANDIDATES = "candidates";
    public static final String ACCEPTED = "accepted";
    public static final String UNRESOLVED = "unresolved";
    public static final String AGREEMENT_DEFECT = "agreement_defect";
    public static final String UNSYNTHESIZABLE = "unsynthesizable";
    public static final String DUPLICATE = "duplicate";
    public static final String REJECTED_PREFIX = "rejected:";

    private final ConcurrentMap<String, LongAdder> totals = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> acceptedByPhenomenon = new ConcurrentHashMap<>();

    public void record(String reason) {
        totals.computeIfAbsent(reason, key -> new LongAdder()).increment();
    }

    public void recordRejection(String checkName) {
        record(REJECTED_PREFIX + checkName);
    }

    public void recordAccepted(String phenomenonId) {
        record(ACCEPTED);
        acceptedByPhenomenon.computeIfAbsent(phenomenonId, key -> new LongAdder()).increment();
    }

    public long count(String reason) {
        LongAdder adder = totals.get(reason);
        return adder == null ? 0 : adder.sum();
    }

    public long rejections(String checkName) {
        return count(REJECTED_PREFIX + checkName);
    }

    public long accepted(String phenomenonId) {
        LongAdder adder = acceptedByPhenomenon.get(phenomenonId);
        return adder == null ? 0 : adder.sum();
    }

    public Map<String, Long> totals() {
        return snapshot(totals);
    }

    public Map<String, Long> acceptedByPhenomenon() {
        return snapshot(acceptedByPhenomenon);
    }

    private static Map<String, Long> snapshot(Map<String, LongAdder> counters) {
        Map<String, Long> result = new TreeMap<>();
        counters.forEach((key, adder) -> result.put(key, adder.sum()));
        return result;
    }

    @Override
    public String toString() {
        return "GenerationReport" + totals();
    }
}
