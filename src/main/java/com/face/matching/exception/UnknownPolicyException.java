package com.face.matching.exception;

public class UnknownPolicyException extends RuntimeException {
    public UnknownPolicyException(String mode) {
        super("Unknown match policy: '" + mode + "' (expected 'individually' or 'together')");
    }
}
