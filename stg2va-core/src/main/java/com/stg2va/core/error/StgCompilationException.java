package com.stg2va.core.error;

/**
 * Base class of every fatal compile-time error.
 *
 * <p>These errors are never recovered inside the pipeline: they abort the compilation and
 * no artifact is written.
 */
public abstract class StgCompilationException extends RuntimeException {

    protected StgCompilationException(String message) {
        super(message);
    }

    protected StgCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
