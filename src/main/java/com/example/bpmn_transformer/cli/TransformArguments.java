package com.example.bpmn_transformer.cli;

import com.example.bpmn_transformer.dto.PrivacyDirection;
import com.example.bpmn_transformer.dto.TransformMode;
import com.example.bpmn_transformer.dto.TransformOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.TypeConversionException;

import java.nio.file.Path;

/**
 * Command-line arguments of the transform command. Options left out keep the
 * configured defaults; a repeated option takes its last value and unknown
 * options are ignored with a warning.
 */
@Command(
    name = "transform",
    description = "Fragment a BPMN process by flow coupling, or mask tasks by privacy"
)
public class TransformArguments {

    private static final Logger log = LoggerFactory.getLogger(TransformArguments.class);

    @Parameters(index = "0", paramLabel = "<input.bpmn>", description = "BPMN document to read")
    private Path input;

    @Parameters(index = "1", paramLabel = "<output.bpmn>", description = "Where the rewritten document is written")
    private Path output;

    @Option(names = "--mode", paramLabel = "fragment|mask", converter = ModeConverter.class,
        description = "fragment (default) or mask")
    private TransformMode mode;

    @Option(names = "--threshold", paramLabel = "<float>", converter = FiniteNumberConverter.class,
        description = "Minimum coupling that joins two tasks (default: 0.7)")
    private Double threshold;

    @Option(names = "--privacy", paramLabel = "<float>", converter = FiniteNumberConverter.class,
        description = "Privacy threshold (default: 0.5)")
    private Double privacy;

    @Option(names = "--privacy-dir", paramLabel = "above|below", converter = DirectionConverter.class,
        description = "Mask tasks with privacy >= threshold (above) or < threshold (below, default)")
    private PrivacyDirection privacyDirection;

    @Option(names = "--no-singletons", description = "Do not create groups for single tasks")
    private boolean noSingletons;

    @Option(names = "--clear-old", description = "Remove groups left by an earlier fragmentation first")
    private boolean clearOld;

    /**
     * @throws UsageException when a positional argument is missing or an option value is malformed
     */
    public static TransformOptions parse(String[] args, TransformOptions defaults) throws UsageException {
        TransformArguments parsed = new TransformArguments();
        CommandLine commandLine = commandLine(parsed);
        try {
            commandLine.parseArgs(args == null ? new String[0] : args);
        } catch (ParameterException e) {
            throw new UsageException(e.getMessage());
        }
        for (String unmatched : commandLine.getUnmatchedArguments()) {
            log.warn("Ignoring unknown argument '{}'", unmatched);
        }
        return parsed.applyTo(defaults.copy());
    }

    public static String usage() {
        return commandLine(new TransformArguments()).getUsageMessage();
    }

    private static CommandLine commandLine(TransformArguments target) {
        return new CommandLine(target)
                .setOverwrittenOptionsAllowed(true)
                .setUnmatchedArgumentsAllowed(true);
    }

    private TransformOptions applyTo(TransformOptions options) {
        options.setInput(input).setOutput(output);
        if (mode != null) options.setMode(mode);
        if (threshold != null) options.setThreshold(threshold);
        if (privacy != null) options.setPrivacy(privacy);
        if (privacyDirection != null) options.setPrivacyDirection(privacyDirection);
        if (noSingletons) options.setIncludeSingletons(false);
        if (clearOld) options.setClearOld(true);
        return options;
    }

    static class ModeConverter implements ITypeConverter<TransformMode> {
        @Override
        public TransformMode convert(String value) {
            TransformMode mode = TransformMode.fromValue(value);
            if (mode == null) throw new TypeConversionException("expected fragment or mask, got '" + value + "'");
            return mode;
        }
    }

    static class DirectionConverter implements ITypeConverter<PrivacyDirection> {
        @Override
        public PrivacyDirection convert(String value) {
            PrivacyDirection direction = PrivacyDirection.fromValue(value);
            if (direction == null) throw new TypeConversionException("expected above or below, got '" + value + "'");
            return direction;
        }
    }

    static class FiniteNumberConverter implements ITypeConverter<Double> {
        @Override
        public Double convert(String value) {
            double v;
            try {
                v = Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw new TypeConversionException("expected a number, got '" + value + "'");
            }
            if (!Double.isFinite(v)) throw new TypeConversionException("expected a finite number, got '" + value + "'");
            return v;
        }
    }
}
