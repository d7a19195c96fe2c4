package com.kmg.grobid.cli;

import com.kmg.grobid.model.OptionSet;
import com.kmg.grobid.model.ServiceOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Command line of the client, parsed from Spring's {@link ApplicationArguments}.
 * Options take the {@code --name=value} or {@code --name value} form; flags may be given bare.
 *
 * @param configExplicit whether {@code --config} was given; only then is a missing file an error
 * @param workers        concurrency override, null to use the configured number of processes
 */
public record CommandLineOptions(
        ServiceOperation operation,
        Path input,
        Path output,
        Path config,
        boolean configExplicit,
        Integer workers,
        boolean generateIds,
        boolean consolidateHeader,
        boolean consolidateCitations,
        boolean force,
        boolean teiCoordinates,
        Path report
) {
    private static final Logger log = LoggerFactory.getLogger(CommandLineOptions.class);

    static final Path DEFAULT_CONFIG = Path.of("config.json");

    static final Set<String> KNOWN_OPTIONS = Set.of(
            "input", "output", "config", "n", "generateIDs", "consolidate_header",
            "consolidate_citations", "force", "teiCoordinates", "report", "help", "debug", "trace"
    );

    static final Set<String> VALUE_OPTIONS = Set.of("input", "output", "config", "n", "report");

    public static final String USAGE = """
            Usage: grobid-client <service> --input DIR [options]
            Options taking a value accept both --name=value and --name value.
              service                  one of %s
              --input=DIR              path to the directory containing PDF to process
              --output=DIR             path to the directory where to put the results (optional)
              --config=FILE            path to the config file, default is ./config.json
              --n=N                    concurrency for service usage
              --generateIDs            generate random xml:id to textual XML elements of the result files
              --consolidate_header     call GROBID with consolidation of the metadata extracted from the header
              --consolidate_citations  call GROBID with consolidation of the extracted bibliographical references
              --force                  force re-processing pdf input files when tei output files already exist
              --teiCoordinates         add the original PDF coordinates (bounding boxes) to the extracted elements
              --report=FILE            write a JSON summary of the run
            """.formatted(ServiceOperation.endpointNames());

    public static CommandLineOptions parse(ApplicationArguments source) {
        ApplicationArguments args = new DefaultApplicationArguments(attachValues(source.getSourceArgs()));
        for (String name : args.getOptionNames()) {
            if (!KNOWN_OPTIONS.contains(name) && !name.startsWith("spring.") && !name.startsWith("grobid.")
                    && !name.startsWith("logging.")) {
                throw new IllegalArgumentException("Unknown option --" + name + System.lineSeparator() + USAGE);
            }
        }

        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            throw new IllegalArgumentException("Missing service argument" + System.lineSeparator() + USAGE);
        }
        if (positional.size() > 1) {
            throw new IllegalArgumentException("Unexpected arguments " + positional.subList(1, positional.size())
                    + System.lineSeparator() + USAGE);
        }
        ServiceOperation operation = ServiceOperation.fromName(positional.get(0));

        String input = value(args, "input");
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("--input is required" + System.lineSeparator() + USAGE);
        }
        String output = value(args, "output");
        String config = value(args, "config");
        String report = value(args, "report");

        return new CommandLineOptions(
                operation,
                Path.of(input),
                output == null || output.isBlank() ? null : Path.of(output),
                config == null || config.isBlank() ? DEFAULT_CONFIG : Path.of(config),
                config != null && !config.isBlank(),
                workers(value(args, "n")),
                flag(args, "generateIDs"),
                flag(args, "consolidate_header"),
                flag(args, "consolidate_citations"),
                flag(args, "force"),
                flag(args, "teiCoordinates"),
                report == null || report.isBlank() ? null : Path.of(report)
        );
    }

    /**
     * Rewrites {@code --input DIR} as {@code --input=DIR} for the options that take a value.
     */
    static String[] attachValues(String[] source) {
        List<String> joined = new ArrayList<>(source.length);
        for (int i = 0; i < source.length; i++) {
            String arg = source[i];
            boolean bareValueOption = arg.startsWith("--") && !arg.contains("=")
                    && VALUE_OPTIONS.contains(arg.substring(2));
            if (bareValueOption && i + 1 < source.length && !source[i + 1].startsWith("--")) {
                joined.add(arg + "=" + source[++i]);
            } else {
                joined.add(arg);
            }
        }
        return joined.toArray(new String[0]);
    }

    public OptionSet optionSet(List<String> coordinates) {
        return new OptionSet(generateIds, consolidateHeader, consolidateCitations, teiCoordinates, coordinates);
    }

    private static Integer workers(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            int n = Integer.parseInt(raw.trim());
            if (n > 0) {
                return n;
            }
        } catch (NumberFormatException e) {
            log.debug("Unparseable --n value {}", raw);
        }
        log.warn("Invalid concurrency for parameter n: {}, the configured number of processes will be used", raw);
        return null;
    }

    private static String value(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        String value = value(args, name);
        return value == null || Boolean.parseBoolean(value);
    }
}
