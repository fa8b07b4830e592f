package com.example.rublimp.generator.pairs;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * On-disk layouts of a pair file. Both use the same field names.
 */
public enum PairFormat {
    TSV,
    JSONL;

    static final List<String> COLUMNS = List.of(
            "sentence_id", "source_sentence", "target_sentence", "phenomenon", "phenomenon_id",
            "phenomenon_subtype", "source_word", "target_word", "source_word_feats", "target_word_feats",
            "feature", "domain", "tree_length", "length", "tree_depth");

    /**
     * {@code .jsonl} and {@code .json} files are JSON lines, everything else is TSV.
     */
    public static PairFormat forPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jsonl") || name.endsWith(".json") ? JSONL : TSV;
    }

    public static PairFormat parse(String name) {
        try {
            return valueOf(name.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown pair format '" + name + "', expected tsv or jsonl", ex);
        }
    }
}
