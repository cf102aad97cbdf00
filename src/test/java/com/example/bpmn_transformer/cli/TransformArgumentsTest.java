package com.example.bpmn_transformer.cli;

import com.example.bpmn_transformer.dto.PrivacyDirection;
import com.example.bpmn_transformer.dto.TransformMode;
import com.example.bpmn_transformer.dto.TransformOptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TransformArgumentsTest {

    private final TransformOptions defaults = new TransformOptions();

    @Test
    void defaultsApplyWithOnlyPositionals() throws Exception {
        TransformOptions o = TransformArguments.parse(new String[] {"in.bpmn", "out.bpmn"}, defaults);

        assertEquals(Path.of("in.bpmn"), o.getInput());
        assertEquals(Path.of("out.bpmn"), o.getOutput());
        assertEquals(TransformMode.FRAGMENT, o.getMode());
        assertEquals(0.7, o.getThreshold());
        assertEquals(0.5, o.getPrivacy());
        assertEquals(PrivacyDirection.BELOW, o.getPrivacyDirection());
        assertTrue(o.isIncludeSingletons());
        assertFalse(o.isClearOld());
    }

    @Test
    void parsesAllOptions() throws Exception {
        TransformOptions o = TransformArguments.parse(new String[] {
                "in.bpmn", "out.bpmn", "--mode=mask", "--threshold=0.35", "--privacy=0.8",
                "--privacy-dir=above", "--no-singletons", "--clear-old"}, defaults);

        assertEquals(TransformMode.MASK, o.getMode());
        assertEquals(0.35, o.getThreshold());
        assertEquals(0.8, o.getPrivacy());
        assertEquals(PrivacyDirection.ABOVE, o.getPrivacyDirection());
        assertFalse(o.isIncludeSingletons());
        assertTrue(o.isClearOld());
    }

    @Test
    void configuredDefaultsFillUnsetOptions() throws Exception {
        TransformOptions configured = new TransformOptions()
                .setMode(TransformMode.MASK)
                .setPrivacy(0.3)
                .setPrivacyDirection(PrivacyDirection.ABOVE);

        TransformOptions o = TransformArguments.parse(new String[] {"a", "b", "--privacy=0.9"}, configured);

        assertEquals(TransformMode.MASK, o.getMode());
        assertEquals(0.9, o.getPrivacy());
        assertEquals(PrivacyDirection.ABOVE, o.getPrivacyDirection());
    }

    @Test
    void doesNotMutateDefaults() throws Exception {
        TransformArguments.parse(new String[] {"a", "b", "--threshold=0.1", "--clear-old"}, defaults);
        assertEquals(0.7, defaults.getThreshold());
        assertFalse(defaults.isClearOld());
    }

    @Test
    void fewerThanTwoPositionalsIsUsageError() {
        assertThrows(UsageException.class, () -> TransformArguments.parse(new String[0], defaults));
        assertThrows(UsageException.class, () -> TransformArguments.parse(new String[] {"only-input.bpmn"}, defaults));
        assertThrows(UsageException.class, () -> TransformArguments.parse(null, defaults));
    }

    @Test
    void malformedValuesAreUsageErrors() {
        assertThrows(UsageException.class,
                () -> TransformArguments.parse(new String[] {"a", "b", "--threshold=high"}, defaults));
        assertThrows(UsageException.class,
                () -> TransformArguments.parse(new String[] {"a", "b", "--privacy=NaN"}, defaults));
        assertThrows(UsageException.class,
                () -> TransformArguments.parse(new String[] {"a", "b", "--mode=merge"}, defaults));
        UsageException e = assertThrows(UsageException.class,
                () -> TransformArguments.parse(new String[] {"a", "b", "--privacy-dir=sideways"}, defaults));
        assertTrue(e.getMessage().contains("sideways"));
    }

    @Test
    void unknownOptionsAreIgnored() throws Exception {
        TransformOptions o = TransformArguments.parse(new String[] {"a", "b", "--verbose", "--color=auto"}, defaults);
        assertEquals(TransformMode.FRAGMENT, o.getMode());
        assertEquals(Path.of("b"), o.getOutput());
    }

    @Test
    void laterOptionWins() throws Exception {
        TransformOptions o = TransformArguments.parse(
                new String[] {"a", "b", "--mode=mask", "--mode=fragment"}, defaults);
        assertEquals(TransformMode.FRAGMENT, o.getMode());
    }

    @Test
    void usageNamesTheCommandAndOptions() {
        String usage = TransformArguments.usage();
        assertTrue(usage.contains("Usage:"));
        assertTrue(usage.contains("transform"));
        assertTrue(usage.contains("--privacy-dir"));
        assertTrue(usage.contains("--no-singletons"));
    }
}
