package com.coderaptor.summarize;

public record SummaryOutcome(String text, boolean fallbackUsed, String failureMessage) {
}
