package com.barthel.biasadjust.domain.exception;

import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.Kind;

import java.util.List;

/**
 * Raised for an unrecognised kind, or a kind the requested method cannot apply.
 */
public class KindNotSupportedException extends UnsupportedOperationException {

    public KindNotSupportedException(String kind, List<Kind> validKinds) {
        super("kind='" + kind + "' is not available. Use one of " + symbols(validKinds) + " instead.");
    }

    public KindNotSupportedException(Kind kind, AdjustmentMethod method, List<Kind> validKinds) {
        super("kind='" + kind.symbol() + "' not available for " + method.methodName()
                + ". Use " + symbols(validKinds) + " instead.");
    }

    private static List<String> symbols(List<Kind> kinds) {
        return kinds.stream().map(Kind::symbol).toList();
    }
}
