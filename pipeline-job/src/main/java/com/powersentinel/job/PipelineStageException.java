package com.powersentinel.job;

import com.powersentinel.core.error.PowerSentinelException;

/**
 * A pipeline stage failed; the originating exception is the cause.
 *
 * @since 1.0.0
 */
public class PipelineStageException extends PowerSentinelException {

    private static final long serialVersionUID = 1L;

    private final String stage;
    private final String inputs;

    public PipelineStageException(String stage, String inputs, Throwable cause) {
        super("Stage '" + stage + "' failed (" + inputs + "): " + cause.getMessage(), cause);
        this.stage = stage;
        this.inputs = inputs;
    }

    public String getStage() {
        return stage;
    }

    /** Human-readable description of what the stage was given. */
    public String getInputs() {
        return inputs;
    }
}
