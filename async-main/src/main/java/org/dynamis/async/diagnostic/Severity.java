package org.dynamis.async.diagnostic;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
