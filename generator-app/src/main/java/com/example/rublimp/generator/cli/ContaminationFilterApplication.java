package com.example.rublimp.generator.cli;

import com.example.rublimp.generator.GenerationException;
import com.example.rublimp.generator.contamination.ContaminationThresholdSearch;
import com.example.rublimp.generator.contamination.MinKProbability;
import com.example.rublimp.generator.contamination.ScoreTable;
import com.example.rublimp.generator.contamination.ThresholdResult;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.pairs.MinimalPairReader;
import com.example.rublimp.generator.pairs.MinimalPairWriter;
import com.example.rublimp.generator.pairs.PairFormat;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Command line utility that keeps only the pairs whose grammatical sentence every scoring model
 * ranks at or below the threshold reaching the requested pool size.
 */
public final class ContaminationFilterApplication {

    private final PrintStream out;
    private final PrintStream err;

    public ContaminationFilterApplication(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        ContaminationFilterApplication application = new ContaminationFilterApplication(System.out, System.err);
        int exitCode = application.run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    int run(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 1;
        }
        Path scores = null;
        Path output = null;
        Path pairsFile = null;
        Integer target = null;
        double ratio = MinKProbability.DEFAULT_RATIOS.get(0);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-")) {
                if (pairsFile != null) {
                    err.println("Укажите ровно один файл с парами.");
                    return 1;
                }
                pairsFile = Path.of(arg);
                continue;
            }
            if (i + 1 >= args.length) {
                err.printf("Опция %s требует значение.%n", arg);
                return 1;
            }
            String value = args[++i];
            try {
                switch (arg) {
                    case "--scores":
                        scores = Path.of(value);
                        break;
                    case "--target":
                        target = Integer.parseInt(value);
                        break;
                    case "--ratio":
                        ratio = Double.parseDouble(value);
                        break;
                    case "--output":
                    case "-o":
                        output = Path.of(value);
                        break;
                    default:
                        err.printf("Неизвестная опция: %s%n", arg);
                        printUsage();
                        return 1;
                }
            } catch (NumberFormatException ex) {
                err.printf("Некорректное значение опции %s: %s%n", arg, value);
                return 1;
            }
        }
        if (pairsFile == null || scores == null || target == null || output == null) {
            printUsage();
            return 1;
        }
        for (Path file : List.of(pairsFile, scores)) {
            if (!Files.isRegularFile(file)) {
                err.printf("Файл не найден: %s%n", file);
                return 2;
            }
        }

        List<MinimalPair> pairs;
        ThresholdResult result;
        try {
            pairs = new MinimalPairReader(PairFormat.forPath(pairsFile)).read(pairsFile);
            ScoreTable table = ScoreTable.read(scores, ratio);
            result = new ContaminationThresholdSearch().selectThreshold(table.scoresByModel(), target);
        } catch (IOException | GenerationException | IllegalArgumentException ex) {
            err.printf("Не удалось обработать данные: %s%n", ex.getMessage());
            return 3;
        }
        if (!result.isAttained()) {
            err.printf("Порог для %d предложений недостижим: не более %d предложений во всех моделях.%n",
                    target, result.size());
            return 4;
        }

        List<MinimalPair> kept = ContaminationThresholdSearch.retainEligible(pairs, result.eligibleSentences());
        try {
            new MinimalPairWriter(PairFormat.forPath(output)).write(output, kept);
        } catch (IOException ex) {
            err.printf("Не удалось записать пары: %s%n", ex.getMessage());
            return 3;
        }
        out.printf("Порог %.4f: %d предложений, сохранено пар %d из %d%n",
                result.threshold(), result.size(), kept.size(), pairs.size());
        return 0;
    }

    private void printUsage() {
        err.println("Использование: java -cp generator-app-<версия>.jar "
                + "com.example.rublimp.generator.cli.ContaminationFilterApplication "
                + "--scores <логвероятности.json> --target <n> [--ratio <доля>] --output <файл> <пары.tsv|пары.jsonl>");
    }
}
