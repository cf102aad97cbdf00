package com.example.bpmn_transformer.cli;

import com.example.bpmn_transformer.dto.PrivacyDirection;
import com.example.bpmn_transformer.dto.TransformMode;
import com.example.bpmn_transformer.dto.TransformOptions;
import com.example.bpmn_transformer.dto.TransformResult;
import com.example.bpmn_transformer.exception.InvalidDocumentException;
import com.example.bpmn_transformer.service.TransformService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

/**
 * Command-line entry point. Exit codes: 0 success, 1 usage error,
 * 2 unreadable or unusable document / I/O failure.
 */
@Component
@ConditionalOnProperty(name = "app.cli.enabled", havingValue = "true", matchIfMissing = true)
public class TransformCommand implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(TransformCommand.class);

    @Autowired
    private TransformService transformService;

    @Value("${app.transform.mode:fragment}")
    private String defaultMode;

    @Value("${app.transform.threshold:0.7}")
    private double defaultThreshold;

    @Value("${app.transform.privacy:0.5}")
    private double defaultPrivacy;

    @Value("${app.transform.privacy-dir:below}")
    private String defaultPrivacyDir;

    private int exitCode = 0;

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    int execute(String... args) {
        TransformOptions options;
        try {
            options = TransformArguments.parse(args, defaults());
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            System.err.print(TransformArguments.usage());
            return 1;
        }

        try {
            TransformResult result = transformService.transform(options);
            System.out.println(result.summaryLine());
            System.out.println("Wrote " + options.getOutput());
            return 0;
        } catch (InvalidDocumentException | UncheckedIOException e) {
            log.error("Transform of {} failed", options.getInput(), e);
            System.err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    TransformOptions defaults() {
        TransformMode mode = TransformMode.fromValue(defaultMode);
        PrivacyDirection dir = PrivacyDirection.fromValue(defaultPrivacyDir);
        if (mode == null) throw new IllegalStateException("Invalid app.transform.mode: " + defaultMode);
        if (dir == null) throw new IllegalStateException("Invalid app.transform.privacy-dir: " + defaultPrivacyDir);
        return new TransformOptions()
                .setMode(mode)
                .setThreshold(defaultThreshold)
                .setPrivacy(defaultPrivacy)
                .setPrivacyDirection(dir);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
