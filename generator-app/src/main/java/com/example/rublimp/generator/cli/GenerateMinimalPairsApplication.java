package com.example.rublimp.generator.cli;

import com.example.rublimp.generator.GenerationException;
import com.example.rublimp.generator.GenerationReport;
import com.example.rublimp.generator.GeneratorConfig;
import com.example.rublimp.generator.MinimalPairService;
import com.example.rublimp.generator.pairs.MinimalPair;
import com.example.rublimp.generator.pairs.MinimalPairWriter;
import com.example.rublimp.generator.pairs.PairFormat;
import com.example.rublimp.generator.sentence.AnnotatedSentence;
import com.example.rublimp.generator.sentence.ConlluReader;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Command line utility that reads CoNLL-U files and writes the minimal pairs generated from their
 * sentences as TSV or JSON lines.
 */
public final class GenerateMinimalPairsApplication {

    private final GeneratorConfig baseConfig;
    private final PrintStream out;
    private final PrintStream err;

    public GenerateMinimalPairsApplication(GeneratorConfig baseConfig, PrintStream out, PrintStream err) {
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        GenerateMinimalPairsApplication application =
                new GenerateMinimalPairsApplication(GeneratorConfig.fromEnvironment(), System.out, System.err);
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
        GeneratorConfig config = baseConfig;
        PairFormat format = null;
        Path output = null;
        List<Path> inputs = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("-")) {
                if (i + 1 >= args.length) {
                    err.printf("Опция %s требует значение.%n", arg);
                    return 1;
                }
                String value = args[++i];
                try {
                    switch (arg) {
                        case "--lexicon":
                            config = config.withLexiconPath(Path.of(value));
                            break;
                        case "--tables":
                            config = config.withTablesDirectory(Path.of(value));
                            break;
                        case "--workers":
                            config = config.withWorkers(Integer.parseInt(value));
                            break;
                        case "--domain":
                            config = config.withDomain(value);
                            break;
                        case "--phenomena":
                            config = config.withPhenomena(Arrays.asList(value.split(",")));
                            break;
                        case "--format":
                            format = PairFormat.parse(value);
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
                } catch (IllegalArgumentException ex) {
                    err.printf("Некорректное значение опции %s: %s%n", arg, ex.getMessage());
                    return 1;
                }
                continue;
            }
            Path file = Path.of(arg);
            if (!Files.exists(file)) {
                err.printf("Файл не найден: %s%n", file);
                return 2;
            }
            if (!Files.isRegularFile(file)) {
                err.printf("Не является файлом: %s%n", file);
                return 2;
            }
            inputs.add(file);
        }
        if (inputs.isEmpty()) {
            err.println("Не указаны входные файлы CoNLL-U.");
            printUsage();
            return 1;
        }
        if (format == null) {
            format = output == null ? PairFormat.TSV : PairFormat.forPath(output);
        }

        List<AnnotatedSentence> sentences = new ArrayList<>();
        int failures = 0;
        for (Path input : inputs) {
            try {
                sentences.addAll(ConlluReader.read(input));
            } catch (GenerationException ex) {
                failures++;
                err.printf("Не удалось прочитать файл %s: %s%n", input, ex.getMessage());
            }
        }

        GenerationReport report = new GenerationReport();
        List<MinimalPair> pairs;
        try (MinimalPairService service = new MinimalPairService(config)) {
            pairs = service.generate(sentences, report);
        } catch (GenerationException | IllegalArgumentException ex) {
            err.printf("Ошибка генерации: %s%n", ex.getMessage());
            return 3;
        }

        MinimalPairWriter writer = new MinimalPairWriter(format);
        try {
            if (output == null) {
                Writer stdout = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                writer.write(stdout, pairs);
            } else {
                writer.write(output, pairs);
            }
        } catch (IOException ex) {
            err.printf("Не удалось записать пары: %s%n", ex.getMessage());
            return 3;
        }
        printSummary(report, pairs.size(), sentences.size());

        if (failures > 0) {
            err.printf("Завершено с ошибками (%d файлов не обработано).%n", failures);
            return 3;
        }
        return 0;
    }

    private void printSummary(GenerationReport report, int pairs, int sentences) {
        err.printf("Предложений: %d, минимальных пар: %d%n", sentences, pairs);
        for (Map.Entry<String, Long> entry : report.totals().entrySet()) {
            err.printf("  %s: %d%n", entry.getKey(), entry.getValue());
        }
    }

    private void printUsage() {
        err.println("Использование: java -cp generator-app-<версия>.jar "
                + "com.example.rublimp.generator.cli.GenerateMinimalPairsApplication "
                + "[--lexicon <файл>] [--tables <каталог>] [--workers <n>] [--domain <имя>] "
                + "[--phenomena <id,семейство,...>] [--format tsv|jsonl] [--output <файл>] "
                + "<файл.conllu> [<файл.conllu> ...]");
        err.println("Без --output пары печатаются в стандартный вывод.");
    }
}
