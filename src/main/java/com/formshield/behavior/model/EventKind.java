package com.formshield.behavior.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Interaction event kinds the UI layer forwards to a tracking session.
 */
public enum EventKind {
    POINTER_MOVE,
    POINTER_DOWN,
    CLICK,
    TOUCH_START,
    TOUCH_MOVE,
    TOUCH_END,
    KEY_DOWN,
    KEY_UP,
    FOCUS,
    BLUR,
    VISIBILITY_CHANGE,
    PASTE,
    FIELD_INPUT;

    /**
     * Accepts both {@code POINTER_MOVE} and the DOM-style {@code pointer-move}.
     * Unknown kinds map to null so the event is ignored rather than rejected.
     */
    @JsonCreator
    public static EventKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (EventKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * Kinds that count as the user's first deliberate interaction with the page.
     */
    public boolean isQualifyingInteraction() {
        return this == POINTER_MOVE || this == POINTER_DOWN || this == CLICK
                || this == TOUCH_START || this == KEY_DOWN;
    }
}
