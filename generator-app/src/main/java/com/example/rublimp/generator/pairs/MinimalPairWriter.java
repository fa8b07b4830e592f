package com.example.rublimp.generator.pairs;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Writes pairs as a TSV table with a header row, or as one JSON object per line.
 */
public final class MinimalPairWriter {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final PairFormat format;

    public MinimalPairWriter(PairFormat format) {
        this.format = Objects.requireNonNull(format, "format");
    }

    public void write(Path file, Collection<MinimalPair> pairs) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(writer, pairs);
        }
    }

    public void write(Writer writer, Collection<MinimalPair> pairs) throws IOException {
        if (format == PairFormat.TSV) {
            writer.write(String.join("\t", PairFormat.COLUMNS));
            writer.write('\n');
        }
        for (MinimalPair pair : pairs) {
            writer.write(format == PairFormat.TSV ? toTsv(pair) : GSON.toJson(toJson(pair)));
            writer.write('\n');
        }
        writer.flush();
    }

    static String toTsv(MinimalPair pair) {
        String[] cells = {
                pair.sentenceId(),
                pair.sourceSentence(),
                pair.targetSentence(),
                pair.phenomenon(),
                pair.phenomenonId(),
                pair.phenomenonSubtype(),
                pair.sourceWord(),
                pair.targetWord(),
                pair.sourceWordFeatures().toString(),
                pair.targetWordFeatures().toString(),
                pair.feature(),
                pair.domain(),
                Integer.toString(pair.treeLength()),
                Integer.toString(pair.length()),
                Integer.toString(pair.treeDepth())
        };
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                line.append('\t');
            }
            line.append(cells[i].replace('\t', ' ').replace('\n', ' ').replace('\r', ' '));
        }
        return line.toString();
    }

    static JsonObject toJson(MinimalPair pair) {
        JsonObject object = new JsonObject();
        object.addProperty("sentence_id", pair.sentenceId());
        object.addProperty("source_sentence", pair.sourceSentence());
        object.addProperty("target_sentence", pair.targetSentence());
        object.addProperty("phenomenon", pair.phenomenon());
        object.addProperty("phenomenon_id", pair.phenomenonId());
        object.addProperty("phenomenon_subtype", pair.phenomenonSubtype());
        object.addProperty("source_word", pair.sourceWord());
        object.addProperty("target_word", pair.targetWord());
        object.add("source_word_feats", features(pair.sourceWordFeatures().asMap()));
        object.add("target_word_feats", features(pair.targetWordFeatures().asMap()));
        object.addProperty("feature", pair.feature());
        object.addProperty("domain", pair.domain());
        object.addProperty("tree_length", pair.treeLength());
        object.addProperty("length", pair.length());
        object.addProperty("tree_depth", pair.treeDepth());
        return object;
    }

    private static JsonObject features(Map<String, String> features) {
        JsonObject object = new JsonObject();
        features.forEach(object::addProperty);
        return object;
    }
}
