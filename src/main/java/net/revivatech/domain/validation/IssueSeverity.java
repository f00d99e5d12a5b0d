package net.revivatech.domain.validation;

public enum IssueSeverity {
    ERROR,
    WARNING,
    SUGGESTION
}
