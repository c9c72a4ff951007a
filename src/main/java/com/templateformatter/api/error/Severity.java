package com.templateformatter.api.error;

public enum Severity {
    FATAL,   // Template could not be parsed or printed
    ERROR,   // Rule violations that change rendered output
    WARNING, // Style issues
    INFO     // Informational messages
}
