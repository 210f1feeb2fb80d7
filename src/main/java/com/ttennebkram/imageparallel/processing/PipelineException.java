package com.ttennebkram.imageparallel.processing;

/**
 * Thrown when a pipeline run has to be aborted as a whole,
 * e.g. a sub-buffer went missing before merge-back or the coordinator was interrupted.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
