package com.templateformatter.lint;

public enum FixSafety {
    SAFE,   // Preserves rendered output, applied by default
    UNSAFE, // May change rendered output, applied on request
    NONE    // Never applied automatically
}
