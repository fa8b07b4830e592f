package com.example.rublimp.generator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Run settings. Each value is looked up as a system property, then as an environment variable,
 * then falls back to its default; command line flags override the result through the
 * {@code with*} methods.
 */
public final class GeneratorConfig {

    static final String LEXICON_PROPERTY = "rublimp.lexicon.path";
    static final String LEXICON_ENV = "RUBLIMP_LEXICON";
    static final String TABLES_PROPERTY = "rublimp.tables.dir";
    static final String TABLES_ENV = "RUBLIMP_TABLES_DIR";
    static final String WORKERS_PROPERTY = "rublimp.workers";
    static final String WORKERS_ENV = "RUBLIMP_WORKERS";
    static final String DOMAIN_PROPERTY = "rublimp.domain";
    static final String DOMAIN_ENV = "RUBLIMP_DOMAIN";

    public static final String DEFAULT_DOMAIN = "corpus";

    private final Path lexiconPath;
    private final Path tablesDirectory;
    private final int workers;
    private final String domain;
    private final List<String> phenomena;

    private GeneratorConfig(Path lexiconPath, Path tablesDirectory, int workers, String domain,
                            List<String> phenomena) {
        if (workers < 1) {
            throw new IllegalArgumentException("Worker count must be positive: " + workers);
        }
        this.lexiconPath = lexiconPath;
        this.tablesDirectory = tablesDirectory;
        this.workers = workers;
        this.domain = Objects.requireNonNull(domain, "domain");
        this.phenomena = List.copyOf(phenomena);
    }

    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, null, Runtime.getRuntime().availableProcessors(), DEFAULT_DOMAIN, List.of());
    }

    public static GeneratorConfig fromEnvironment() {
        return from(System.getProperties(), System.getenv());
    }

    static GeneratorConfig from(Properties properties, Map<String, String> environment) {
        GeneratorConfig config = defaults();
        Optional<String> lexicon = lookup(properties, environment, LEXICON_PROPERTY, LEXICON_ENV);
        if (lexicon.isPresent()) {
            config = config.withLexiconPath(Path.of(lexicon.get()));
        }
        Optional<String> tables = lookup(properties, environment, TABLES_PROPERTY, TABLES_ENV);
        if (tables.isPresent()) {
            config = config.withTablesDirectory(Path.of(tables.get()));
        }
        Optional<String> workers = lookup(properties, environment, WORKERS_PROPERTY, WORKERS_ENV);
        if (workers.isPresent()) {
            try {
                config = config.withWorkers(Integer.parseInt(workers.get().strip()));
            } catch (NumberFormatException ex) {
                throw new GenerationException("Invalid worker count '" + workers.get() + "'", ex);
            }
        }
        Optional<String> domain = lookup(properties, environment, DOMAIN_PROPERTY, DOMAIN_ENV);
        if (domain.isPresent()) {
            config = config.withDomain(domain.get());
        }
        return config;
    }

    private static Optional<String> lookup(Properties properties, Map<String, String> environment,
                                           String property, String variable) {
        String value = properties.getProperty(property);
        if (value != null && !value.isBlank()) {
            return Optional.of(value.strip());
        }
        value = environment.get(variable);
        if (value != null && !value.isBlank()) {
            return Optional.of(value.strip());
        }
        return Optional.empty();
    }

    /** Paradigm lexicon file; empty means the bundled resource. */
    public Optional<Path> lexiconPath() {
        return Optional.ofNullable(lexiconPath);
    }

    /** Directory of curated tables; empty means the bundled resources. */
    public Optional<Path> tablesDirectory() {
        return Optional.ofNullable(tablesDirectory);
    }

    public int workers() {
        return workers;
    }

    public String domain() {
        return domain;
    }

    /** Selected phenomenon ids or families; empty selects all. */
    public List<String> phenomena() {
        return phenomena;
    }

    public GeneratorConfig withLexiconPath(Path path) {
        return new GeneratorConfig(path, tablesDirectory, workers, domain, phenomena);
    }

    public GeneratorConfig withTablesDirectory(Path directory) {
        return new GeneratorConfig(lexiconPath, directory, workers, domain, phenomena);
    }

    public GeneratorConfig withWorkers(int count) {
        return new GeneratorConfig(lexiconPath, tablesDirectory, count, domain, phenomena);
    }

    public GeneratorConfig withDomain(String value) {
        return new GeneratorConfig(lexiconPath, tablesDirectory, workers, value, phenomena);
    }

    public GeneratorConfig withPhenomena(List<String> selection) {
        return new GeneratorConfig(lexiconPath, tablesDirectory, workers, domain, new ArrayList<>(selection));
    }

    @Override
    public String toString() {
        return "GeneratorConfig{lexicon=" + (lexiconPath == null ? "<bundled>" : lexiconPath)
                + ", tables=" + (tablesDirectory == null ? "<bundled>" : tablesDirectory)
                + ", workers=" + workers + ", domain=" + domain + ", phenomena=" + phenomena + '}';
    }
}
