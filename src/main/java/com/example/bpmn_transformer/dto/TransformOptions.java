package com.example.bpmn_transformer.dto;

import java.nio.file.Path;

public class TransformOptions {
    private Path input;
    private Path output;
    private TransformMode mode = TransformMode.FRAGMENT;
    private double threshold = 0.7;
    private double privacy = 0.5;
    private PrivacyDirection privacyDirection = PrivacyDirection.BELOW;
    private boolean includeSingletons = true;
    private boolean clearOld = false;

    public TransformOptions() {}

    public TransformOptions copy() {
        TransformOptions o = new TransformOptions();
        o.input = input;
        o.output = output;
        o.mode = mode;
        o.threshold = threshold;
        o.privacy = privacy;
        o.privacyDirection = privacyDirection;
        o.includeSingletons = includeSingletons;
        o.clearOld = clearOld;
        return o;
    }

    public Path getInput() { return input; }
    public TransformOptions setInput(Path input) { this.input = input; return this; }
    public Path getOutput() { return output; }
    public TransformOptions setOutput(Path output) { this.output = output; return this; }
    public TransformMode getMode() { return mode; }
    public TransformOptions setMode(TransformMode mode) { this.mode = mode; return this; }
    public double getThreshold() { return threshold; }
    public TransformOptions setThreshold(double threshold) { this.threshold = threshold; return this; }
    public double getPrivacy() { return privacy; }
    public TransformOptions setPrivacy(double privacy) { this.privacy = privacy; return this; }
    public PrivacyDirection getPrivacyDirection() { return privacyDirection; }
    public TransformOptions setPrivacyDirection(PrivacyDirection privacyDirection) { this.privacyDirection = privacyDirection; return this; }
    public boolean isIncludeSingletons() { return includeSingletons; }
    public TransformOptions setIncludeSingletons(boolean includeSingletons) { this.includeSingletons = includeSingletons; return this; }
    public boolean isClearOld() { return clearOld; }
    public TransformOptions setClearOld(boolean clearOld) { this.clearOld = clearOld; return this; }

    @Override
    public String toString() {
        return "TransformOptions{input=" + input + ", output=" + output + ", mode=" + mode
                + ", threshold=" + threshold + ", privacy=" + privacy + ", privacyDirection=" + privacyDirection
                + ", includeSingletons=" + includeSingletons + ", clearOld=" + clearOld + "}";
    }
}
