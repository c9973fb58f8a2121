package org.hastats.migrations.pipeline.error;

import lombok.Getter;

/**
 * A fatal failure stopped the run. The last good checkpoint is left in place and
 * {@link #getResumeInstruction()} tells the operator how to continue.
 */
@Getter
public class MigrationAbortedException extends MigrationException {

    private final String resumeInstruction;

    public MigrationAbortedException(String message, String resumeInstruction, Throwable cause) {
        super(message + ". " + resumeInstruction, cause);
        this.resumeInstruction = resumeInstruction;
    }
}
