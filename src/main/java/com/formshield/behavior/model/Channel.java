package com.formshield.behavior.model;

/**
 * One category of interaction signal. Each channel has its own accumulator and scorer.
 */
public enum Channel {
    POINTER,
    TOUCH,
    CLICK,
    KEYBOARD,
    TIMING
}
