package org.processdiagram.converter.validation;

public enum Severity {
    INFO,
    WARNING,
    RECOVERABLE_ERROR
}
