package io.eligian.core.validation;

/** Diagnostic severity. Only {@link #ERROR} blocks compilation. */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
