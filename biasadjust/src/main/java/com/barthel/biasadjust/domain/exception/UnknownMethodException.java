package com.barthel.biasadjust.domain.exception;

import java.util.List;

/**
 * Raised when a method name does not match any implemented technique.
 */
public class UnknownMethodException extends IllegalArgumentException {

    public UnknownMethodException(String method, List<String> availableMethods) {
        super("Unknown method \"" + method + "\"! Available methods: " + availableMethods);
    }
}
