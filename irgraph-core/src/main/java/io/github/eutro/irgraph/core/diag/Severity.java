package io.github.eutro.irgraph.core.diag;

public enum Severity {
    ERROR,
    WARNING,
    NOTE,
}
