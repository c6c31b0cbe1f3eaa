package com.phoenix.core.detection;

import com.phoenix.core.model.SignalKey;

/**
 * Thrown when a baseline is requested for a signal that has fewer than the
 * required number of samples. Callers check
 * {@link BaselineLearner#isReady(String, String)} first.
 *
 * @since 1.0.0
 */
public class BaselineNotReadyException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final SignalKey signal;
    private final long samples;
    private final int required;

    public BaselineNotReadyException(SignalKey signal, long samples, int required) {
        super("Baseline not ready for " + signal + ": " + samples + " of " + required + " sample(s)");
        this.signal = signal;
        this.samples = samples;
        this.required = required;
    }

    public SignalKey getSignal() {
        return signal;
    }

    public long getSamples() {
        return samples;
    }

    public int getRequired() {
        return required;
    }
}
