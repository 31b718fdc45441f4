package com.librenovel.decompiler;

/**
 * Exception thrown when a script cannot be decompiled.
 * Aborts the unit being rendered.
 */
public class DecompilerException extends RuntimeException {

    public DecompilerException(String message) {
        super(message);
    }

    public DecompilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
