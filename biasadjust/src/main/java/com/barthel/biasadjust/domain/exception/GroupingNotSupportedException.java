package com.barthel.biasadjust.domain.exception;

/**
 * Raised when a grouping is requested that cannot be applied.
 */
public class GroupingNotSupportedException extends IllegalArgumentException {

    public GroupingNotSupportedException(String message) {
        super(message);
    }
}
