package com.optionbot.model;

public record ScoredHeadline(int index, Headline headline, double score) {
}
