package com.coderaptor.summarize;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.runtime.RetryPolicy;

public class RetryingSummarizer {
    private static final Logger log = LoggerFactory.getLogger(RetryingSummarizer.class);

    private final Summarizer delegate;
    private final RetryPolicy retryPolicy;
    private final ExtractiveSummarizer fallback = new ExtractiveSummarizer();
    private final int inputMaxChars;
    private final int outputMaxChars;

    public RetryingSummarizer(Summarizer delegate, RetryPolicy retryPolicy, int inputMaxChars, int outputMaxChars) {
        this.delegate = delegate;
        this.retryPolicy = retryPolicy;
        this.inputMaxChars = inputMaxChars;
        this.outputMaxChars = outputMaxChars;
    }

    public SummaryOutcome summarize(List<String> memberTexts) {
        String input = prepareInput(memberTexts);
        if (input.isEmpty()) {
            return new SummaryOutcome("", false, "");
        }
        try {
            String summary = retryPolicy.run("summarize", SummarizationException.class, () -> {
                String result = delegate.summarize(input);
                if (result == null || result.isBlank()) {
                    throw new SummarizationException("summarizer returned an empty result");
                }
                return result;
            });
            return new SummaryOutcome(truncate(summary.strip(), outputMaxChars), false, "");
        } catch (SummarizationException e) {
            log.warn("summary.fallback inputChars={} reason={}", input.length(), e.getMessage());
            String extractive = fallback.summarize(input);
            return new SummaryOutcome(truncate(extractive, outputMaxChars), true, e.getMessage());
        }
    }

    String prepareInput(List<String> memberTexts) {
        StringBuilder builder = new StringBuilder();
        for (String text : memberTexts) {
            String line = text.strip().replaceAll("\\s+", " ");
            if (line.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append("- ").append(line);
            if (builder.length() >= inputMaxChars) {
                break;
            }
        }
        return truncate(builder.toString(), inputMaxChars);
    }

    private static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
