package com.tyron.textseek.core.charset;

/**
 * Thrown when a {@link com.tyron.textseek.api.charset.CharClassifier} breaks its contract.
 * This is a programming error in the supplied classifier, not a recoverable condition.
 */
public class CharClassifierContractException extends IllegalStateException {

    public CharClassifierContractException(String message) {
        super(message);
    }
}
