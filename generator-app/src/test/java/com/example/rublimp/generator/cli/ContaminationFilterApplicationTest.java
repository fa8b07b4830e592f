package com.example.rublimp.generator.cli;

import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.pairs.MinimalPairReader;
import com.example.rublimp.generator.pairs.MinimalPairWriter;
import com.example.rublimp.generator.pairs.PairFormat;
import com.example.rublimp.generator.sentence.FeatureBundle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContaminationFilterApplicationTest {

    private static final String SCORES = "{\"model-a\": {\"Мама мыла раму.\": [-1.0], \"Папа читал книгу.\": [-5.0]},"
            + " \"model-b\": {\"Мама мыла раму.\": [-2.0], \"Папа читал книгу.\": [-4.0]}}";

    @TempDir
    Path directory;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private ContaminationFilterApplication application;
    private Path pairsFile;
    private Path scoresFile;

    @BeforeEach
    void setUp() throws IOException {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        application = new ContaminationFilterApplication(
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
        pairsFile = directory.resolve("pairs.tsv");
        new MinimalPairWriter(PairFormat.TSV).write(pairsFile, List.of(
                pair("s1", "Мама мыла раму.", "Мама мыли раму."),
                pair("s2", "Папа читал книгу.", "Папа читали книгу.")));
        scoresFile = directory.resolve("scores.json");
        Files.writeString(scoresFile, SCORES, StandardCharsets.UTF_8);
    }

    @Test
    void keepsPairsOfSentencesUnderTheThreshold() throws IOException {
        Path output = directory.resolve("kept.jsonl");

        int exitCode = application.run(new String[]{"--scores", scoresFile.toString(), "--target", "1",
                "--ratio", "1.0", "--output", output.toString(), pairsFile.toString()});

        assertEquals(0, exitCode, errBuffer.toString(StandardCharsets.UTF_8));
        List<MinimalPair> kept = new MinimalPairReader(PairFormat.JSONL).read(output);
        assertEquals(1, kept.size());
        assertEquals("s1", kept.get(0).sentenceId());
        assertTrue(outBuffer.toString(StandardCharsets.UTF_8).contains("сохранено пар 1 из 2"));
    }

    @Test
    void unattainableTargetExitsWithFour() {
        int exitCode = application.run(new String[]{"--scores", scoresFile.toString(), "--target", "3",
                "--output", directory.resolve("kept.tsv").toString(), pairsFile.toString()});

        assertEquals(4, exitCode);
        assertTrue(errBuffer.toString(StandardCharsets.UTF_8).contains("недостижим"));
        assertTrue(Files.notExists(directory.resolve("kept.tsv")));
    }

    @Test
    void missingScoresFileExitsWithTwo() {
        int exitCode = application.run(new String[]{"--scores", directory.resolve("none.json").toString(),
                "--target", "1", "--output", directory.resolve("kept.tsv").toString(), pairsFile.toString()});

        assertEquals(2, exitCode);
    }

    @Test
    void requiredOptionsAreChecked() {
        assertEquals(1, application.run(new String[]{pairsFile.toString()}));
        assertEquals(1, application.run(new String[]{"--target", "many", pairsFile.toString()}));
    }

    @Test
    void zeroTargetIsReportedAsBadData() {
        int exitCode = application.run(new String[]{"--scores", scoresFile.toString(), "--target", "0",
                "--output", directory.resolve("kept.tsv").toString(), pairsFile.toString()});

        assertEquals(3, exitCode);
    }

    private static MinimalPair pair(String id, String source, String target) {
        return MinimalPair.builder()
                .sentenceId(id)
                .sentences(source, target)
                .phenomenon("agreement", "noun_subj_predicate_agreement_number", "noun_subj_predicate_agreement_number")
                .words(source.split(" ")[1], target.split(" ")[1])
                .wordFeatures(FeatureBundle.parse("Number=Sing"), FeatureBundle.parse("Number=Plur"))
                .feature("Number")
                .domain("wiki")
                .treeLength(1)
                .length(4)
                .treeDepth(2)
                .build();
    }
}
