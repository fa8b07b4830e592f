package com.example.rublimp.generator.sentence;

import com.example.rublimp.generator.GenerationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reads CoNLL-U parser output into {@link AnnotatedSentence}s. Sentences are separated by blank
 * lines; multiword-token ranges ({@code 3-4}) and empty nodes ({@code 5.1}) are skipped.
 */
public final class ConlluReader {

    private static final String SENT_ID = "# sent_id";
    private static final String TEXT = "# text";

    private ConlluReader() {
    }

    public static List<AnnotatedSentence> read(Path file) {
        Objects.requireNonNull(file, "file");
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.getFileName().toString());
        } catch (IOException ex) {
            throw new GenerationException("Failed to read CoNLL-U file " + file.toAbsolutePath(), ex);
        }
    }

    public static List<AnnotatedSentence> parse(String conllu) {
        try {
            return read(new StringReader(conllu), "input");
        } catch (IOException ex) {
            throw new GenerationException("Failed to parse CoNLL-U input", ex);
        }
    }

    static List<AnnotatedSentence> read(Reader source, String sourceName) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source
                : new BufferedReader(source);
        List<AnnotatedSentence> sentences = new ArrayList<>();
        List<String> block = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                if (!block.isEmpty()) {
                    sentences.add(parseBlock(block, sourceName, sentences.size() + 1));
                    block = new ArrayList<>();
                }
                continue;
            }
            block.add(line);
        }
        if (!block.isEmpty()) {
            sentences.add(parseBlock(block, sourceName, sentences.size() + 1));
        }
        return Collections.unmodifiableList(sentences);
    }

    private static AnnotatedSentence parseBlock(List<String> lines, String sourceName, int ordinal) {
        String id = null;
        String text = null;
        List<Token> tokens = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith("#")) {
                if (line.startsWith(SENT_ID)) {
                    id = commentValue(line);
                } else if (line.startsWith(TEXT) && !line.startsWith("# text_")) {
                    text = commentValue(line);
                }
                continue;
            }
            String[] columns = line.split("\t", -1);
            String sentenceId = id != null ? id : sourceName + "#" + ordinal;
            if (columns.length != 10) {
                throw new MalformedSentenceException(sentenceId,
                        "expected 10 columns but found " + columns.length + ": " + line);
            }
            if (columns[0].indexOf('-') >= 0 || columns[0].indexOf('.') >= 0) {
                continue;
            }
            try {
                int index = Integer.parseInt(columns[0]);
                int head = Integer.parseInt(columns[6]);
                tokens.add(new Token(index, columns[1], columns[2], columns[3],
                        FeatureBundle.parse(columns[5]), head, columns[7], !columns[9].contains("SpaceAfter=No")));
            } catch (IllegalArgumentException ex) {
                throw new MalformedSentenceException(sentenceId, "unreadable token line '" + line + "': " + ex.getMessage());
            }
        }
        String sentenceId = id != null ? id : sourceName + "#" + ordinal;
        return AnnotatedSentence.of(sentenceId, text, tokens);
    }

    private static String commentValue(String line) {
        int eq = line.indexOf('=');
        return eq < 0 ? "" : line.substring(eq + 1).strip();
    }
}
