package com.flagged.error;

/**
 * Types of errors that can occur when declaring, looking up or combining flags.
 */
public enum ErrorType {
    ILLEGAL_FLAG_VALUE,
    REPEATED_FLAG_VALUE,
    FLAG_SPACE_EXHAUSTED,
    INVALID_FLAG_NAME,
    DUPLICATE_FLAG_NAME,
    FLAG_NOT_FOUND,
    TYPE_MISMATCH
}
