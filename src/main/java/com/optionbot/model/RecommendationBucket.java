package com.optionbot.model;

public enum RecommendationBucket {
    FAVOR,
    NEUTRAL,
    AVOID
}
