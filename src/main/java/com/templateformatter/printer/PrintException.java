package com.templateformatter.printer;

/**
 * Thrown when a tree cannot be printed, for example because it still carries parse errors.
 */
public class PrintException extends RuntimeException {

    public PrintException(String message) {
        super(message);
    }
}
