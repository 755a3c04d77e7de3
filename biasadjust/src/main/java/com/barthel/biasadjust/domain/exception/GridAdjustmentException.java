package com.barthel.biasadjust.domain.exception;

/**
 * Wraps a checked failure of one grid row.
 */
public class GridAdjustmentException extends RuntimeException {

    public GridAdjustmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
