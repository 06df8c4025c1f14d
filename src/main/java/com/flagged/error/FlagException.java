package com.flagged.error;

import lombok.Getter;

/**
 * Exception thrown by flag set operations.
 * <p>
 * Declaration errors ({@link ErrorType#ILLEGAL_FLAG_VALUE}, {@link ErrorType#REPEATED_FLAG_VALUE},
 * {@link ErrorType#FLAG_SPACE_EXHAUSTED}, {@link ErrorType#INVALID_FLAG_NAME},
 * {@link ErrorType#DUPLICATE_FLAG_NAME}) abort the build of a flag set. Lookup and combination
 * errors are local to the failing call.
 */
@Getter
public class FlagException extends Exception {
    private final ErrorType errorType;
    /** Name of the offending flag, or null when the error is not about a single flag. */
    private final String flagName;

    public FlagException(ErrorType errorType, String message) {
        this(errorType, null, message);
    }

    public FlagException(ErrorType errorType, String flagName, String message) {
        super(message);
        this.errorType = errorType;
        this.flagName = flagName;
    }

    @Override
    public String toString() {
        return String.format("FlagException{type=%s, flag=%s, message='%s'}", errorType, flagName, getMessage());
    }
}
