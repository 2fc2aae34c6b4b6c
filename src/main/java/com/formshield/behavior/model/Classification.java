package com.formshield.behavior.model;

public enum Classification {
    BOT,
    UNCERTAIN,
    HUMAN;

    public static Classification fromScore(double score, double botThreshold, double humanThreshold) {
        if (score <= botThreshold) return BOT;
        if (score >= humanThreshold) return HUMAN;
        return UNCERTAIN;
    }
}
