package com.example.rublimp.generator.pairs;

import com.example.rublimp.generator.sentence.FeatureBundle;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads pair files written by {@link MinimalPairWriter}.
 */
public final class MinimalPairReader {

    private final PairFormat format;

    public MinimalPairReader(PairFormat format) {
        this.format = Objects.requireNonNull(format, "format");
    }

    public List<MinimalPair> read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<MinimalPair> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        List<MinimalPair> pairs = new ArrayList<>();
        String line;
        int lineNumber = 0;
        boolean header = format == PairFormat.TSV;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            if (header) {
                header = false;
                continue;
            }
            try {
                pairs.add(format == PairFormat.TSV ? fromTsv(line) : fromJson(line));
            } catch (IllegalArgumentException | IllegalStateException | JsonParseException ex) {
                throw new IOException("Malformed pair on line " + lineNumber + ": " + ex.getMessage(), ex);
            }
        }
        return pairs;
    }

    static MinimalPair fromTsv(String line) {
        String[] cells = line.split("\t", -1);
        if (cells.length != PairFormat.COLUMNS.size()) {
            throw new IllegalArgumentException("expected " + PairFormat.COLUMNS.size() + " columns, got " + cells.length);
        }
        return MinimalPair.builder()
                .sentenceId(cells[0])
                .sentences(cells[1], cells[2])
                .phenomenon(cells[3], cells[4], cells[5])
                .words(cells[6], cells[7])
                .wordFeatures(FeatureBundle.parse(cells[8]), FeatureBundle.parse(cells[9]))
                .feature(cells[10])
                .domain(cells[11])
                .treeLength(Integer.parseInt(cells[12]))
                .length(Integer.parseInt(cells[13]))
                .treeDepth(Integer.parseInt(cells[14]))
                .build();
    }

    static MinimalPair fromJson(String line) {
        JsonObject object = JsonParser.parseString(line).getAsJsonObject();
        return MinimalPair.builder()
                .sentenceId(string(object, "sentence_id"))
                .sentences(string(object, "source_sentence"), string(object, "target_sentence"))
                .phenomenon(string(object, "phenomenon"), string(object, "phenomenon_id"),
                        string(object, "phenomenon_subtype"))
                .words(string(object, "source_word"), string(object, "target_word"))
                .wordFeatures(features(object, "source_word_feats"), features(object, "target_word_feats"))
                .feature(string(object, "feature"))
                .domain(string(object, "domain"))
                .treeLength(object.get("tree_length").getAsInt())
                .length(object.get("length").getAsInt())
                .treeDepth(object.get("tree_depth").getAsInt())
                .build();
    }

    private static String string(JsonObject object, String name) {
        JsonElement element = object.get(name);
        if (element == null || element.isJsonNull()) {
            throw new IllegalArgumentException("missing field " + name);
        }
        return element.getAsString();
    }

    private static FeatureBundle features(JsonObject object, String name) {
        JsonElement element = object.get(name);
        if (element == null || element.isJsonNull()) {
            return FeatureBundle.empty();
        }
        Map<String, String> features = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            features.put(entry.getKey(), entry.getValue().getAsString());
        }
        return FeatureBundle.of(features);
    }
}
