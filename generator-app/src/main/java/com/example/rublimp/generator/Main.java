package com.example.rublimp.generator;

import com.example.rublimp.generator.cli.ContaminationFilterApplication;
import com.example.rublimp.generator.cli.GenerateMinimalPairsApplication;

import java.util.Arrays;

/**
 * Entry point of the generator jar: {@code generate} (the default) or {@code filter}.
 */
public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        if (args.length > 0 && "filter".equals(args[0])) {
            ContaminationFilterApplication.main(Arrays.copyOfRange(args, 1, args.length));
            return;
        }
        if (args.length > 0 && "generate".equals(args[0])) {
            GenerateMinimalPairsApplication.main(Arrays.copyOfRange(args, 1, args.length));
            return;
        }
        GenerateMinimalPairsApplication.main(args);
    }
}
