package com.example.rublimp.generator.cli;

import com.example.rublimp.generator.GeneratorConfig;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.pairs.MinimalPairReader;
import com.example.rublimp.generator.pairs.PairFormat;
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

class GenerateMinimalPairsApplicationTest {

    private static final String CONLLU = String.join("\n",
            "# sent_id = mama-1",
            "# text = Мама мыла раму.",
            "1\tМама\tмама\tNOUN\t_\tAnimacy=Anim|Case=Nom|Gender=Fem|Number=Sing\t2\tnsubj\t_\t_",
            "2\tмыла\tмыть\tVERB\t_\tAspect=Imp|Gender=Fem|Mood=Ind|Number=Sing|Tense=Past|VerbForm=Fin\t0\troot\t_\t_",
            "3\tраму\tрама\tNOUN\t_\tAnimacy=Inan|Case=Acc|Gender=Fem|Number=Sing\t2\tobj\t_\tSpaceAfter=No",
            "4\t.\t.\tPUNCT\t_\t_\t2\tpunct\t_\t_",
            "", "");

    @TempDir
    Path directory;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private GenerateMinimalPairsApplication application;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        application = new GenerateMinimalPairsApplication(GeneratorConfig.defaults().withWorkers(2),
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void writesSelectedPhenomenaToTheOutputFile() throws IOException {
        Path input = directory.resolve("mama.conllu");
        Files.writeString(input, CONLLU, StandardCharsets.UTF_8);
        Path output = directory.resolve("pairs.jsonl");

        int exitCode = application.run(new String[]{
                "--phenomena", "noun_subj_predicate_agreement_number", "--domain", "wiki",
                "--output", output.toString(), input.toString()});

        assertEquals(0, exitCode, errBuffer.toString(StandardCharsets.UTF_8));
        List<MinimalPair> pairs = new MinimalPairReader(PairFormat.JSONL).read(output);
        assertEquals(1, pairs.size());
        assertEquals("Мама мыли раму.", pairs.get(0).targetSentence());
        assertEquals("mama-1", pairs.get(0).sentenceId());
        assertEquals("wiki", pairs.get(0).domain());
        assertTrue(errBuffer.toString(StandardCharsets.UTF_8).contains("минимальных пар: 1"),
                "Сводка печатается в поток ошибок");
    }

    @Test
    void printsTsvToStandardOutputByDefault() throws IOException {
        Path input = directory.resolve("mama.conllu");
        Files.writeString(input, CONLLU, StandardCharsets.UTF_8);

        int exitCode = application.run(new String[]{"--phenomena", "agreement", input.toString()});

        assertEquals(0, exitCode);
        String stdout = outBuffer.toString(StandardCharsets.UTF_8);
        assertTrue(stdout.startsWith("sentence_id\t"), stdout);
        assertTrue(stdout.contains("Мама мыли раму."), stdout);
    }

    @Test
    void missingInputIsReported() {
        int exitCode = application.run(new String[]{directory.resolve("absent.conllu").toString()});

        assertEquals(2, exitCode);
        assertTrue(errBuffer.toString(StandardCharsets.UTF_8).contains("Файл не найден"));
    }

    @Test
    void usageErrorsExitWithOne() {
        assertEquals(1, application.run(new String[0]));
        assertEquals(1, application.run(new String[]{"--colour", "red", "x.conllu"}));
        assertEquals(1, application.run(new String[]{"--workers", "zero"}));
        assertTrue(errBuffer.toString(StandardCharsets.UTF_8).contains("Использование"));
    }

    @Test
    void unknownPhenomenonFailsTheRun() throws IOException {
        Path input = directory.resolve("mama.conllu");
        Files.writeString(input, CONLLU, StandardCharsets.UTF_8);

        int exitCode = application.run(new String[]{"--phenomena", "subjunctive", input.toString()});

        assertEquals(3, exitCode);
        assertTrue(errBuffer.toString(StandardCharsets.UTF_8).contains("subjunctive"));
    }

    @Test
    void malformedFileIsCountedAsFailure() throws IOException {
        Path good = directory.resolve("mama.conllu");
        Files.writeString(good, CONLLU, StandardCharsets.UTF_8);
        Path bad = directory.resolve("bad.conllu");
        Files.writeString(bad, "1\tМама\tмама\tNOUN\n\n", StandardCharsets.UTF_8);

        int exitCode = application.run(new String[]{"--phenomena", "agreement", bad.toString(), good.toString()});

        assertEquals(3, exitCode);
        assertTrue(outBuffer.toString(StandardCharsets.UTF_8).contains("Мама мыли раму."),
                "Пары из исправного файла всё равно записаны");
    }
}
