package com.example.bpmn_transformer.cli;

import com.example.bpmn_transformer.service.TransformService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "app.cli.enabled=false")
@ExtendWith(OutputCaptureExtension.class)
class TransformCommandTest {

    @Autowired
    private TransformService transformService;

    @TempDir
    Path tempDir;

    private TransformCommand command;

    @BeforeEach
    void setUp() {
        command = new TransformCommand();
        ReflectionTestUtils.setField(command, "transformService", transformService);
        ReflectionTestUtils.setField(command, "defaultMode", "fragment");
        ReflectionTestUtils.setField(command, "defaultThreshold", 0.7);
        ReflectionTestUtils.setField(command, "defaultPrivacy", 0.5);
        ReflectionTestUtils.setField(command, "defaultPrivacyDir", "below");
    }

    private Path copyFixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/bpmn/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void missingArgumentsPrintUsage(CapturedOutput output) {
        assertEquals(1, command.execute("only-input.bpmn"));
        assertTrue(output.getErr().contains("Usage"));
    }

    @Test
    void fragmentsWithDefaults(CapturedOutput output) throws IOException {
        Path input = copyFixture("chain-coupling.bpmn");
        Path out = tempDir.resolve("out.bpmn");

        command.run(input.toString(), out.toString());

        assertEquals(0, command.getExitCode());
        assertTrue(output.getOut().contains("Fragmented into 1 group(s)"));
        assertTrue(output.getOut().contains(out.toString()));
        assertTrue(Files.exists(out));
    }

    @Test
    void masksWithOptions(CapturedOutput output) throws IOException {
        Path input = copyFixture("mask-chain.bpmn");
        Path out = tempDir.resolve("masked.bpmn");

        int code = command.execute(input.toString(), out.toString(), "--mode=mask", "--privacy=0.5",
                "--privacy-dir=above");

        assertEquals(0, code);
        assertTrue(output.getOut().contains("Masked 2 task(s)"));
    }

    @Test
    void unreadableInputExitsWithTwo(CapturedOutput output) {
        Path out = tempDir.resolve("out.bpmn");

        int code = command.execute(tempDir.resolve("missing.bpmn").toString(), out.toString());

        assertEquals(2, code);
        assertTrue(output.getErr().contains("Error:"));
        assertFalse(Files.exists(out));
    }
}
