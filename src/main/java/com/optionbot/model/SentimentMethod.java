package com.optionbot.model;

public enum SentimentMethod {
    CLASSIFIER("classifier"),
    LEXICON("lexicon");

    private final String label;

    SentimentMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
