package com.coderaptor.runtime;

public record IndexWarning(WarningKind kind, String subject, String message) {

    public static IndexWarning of(WarningKind kind, String subject, String message) {
        return new IndexWarning(kind, subject, message == null ? "" : message);
    }

    @Override
    public String toString() {
        return kind + "[" + subject + "]: " + message;
    }
}
