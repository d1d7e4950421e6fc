package com.coderaptor.summarize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class ExtractiveSummarizer implements Summarizer {
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\R+");
    private static final Pattern BULLET = Pattern.compile("^[-*]\\s+");

    @Override
    public String summarize(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }
        List<String> sentences = new ArrayList<>();
        for (String candidate : SENTENCE_BREAK.split(input.strip())) {
            String sentence = BULLET.matcher(candidate.strip()).replaceFirst("").strip();
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
        }
        if (sentences.isEmpty()) {
            return input.strip();
        }
        String first = sentences.get(0);
        String last = sentences.get(sentences.size() - 1);
        if (sentences.size() == 1 || first.equals(last)) {
            return first;
        }
        return first + " " + last;
    }
}
