package com.formshield.behavior.engine.anomaly;

import com.formshield.behavior.config.AnomalyConfig;
import com.formshield.behavior.model.EventKind;
import com.formshield.behavior.model.FlagType;
import com.formshield.behavior.model.InteractionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.formshield.behavior.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class FormActivityMonitorTest {

    private FormActivityMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new FormActivityMonitor(new AnomalyConfig(), "email_confirm", 3);
    }

    private List<FlagType> record(InteractionEvent... events) {
        List<FlagType> types = new ArrayList<>();
        for (InteractionEvent event : events) {
            monitor.record(event, event.getTimestamp()).forEach(d -> types.add(d.getType()));
        }
        return types;
    }

    @Test
    void fieldActivity_tracksFocusAndInput() {
        List<FlagType> flags = record(
                focus("name", 1000),
                fieldInput("name", "J", 1500),
                fieldInput("name", "Jo", 1700),
                focus("name", 3000));

        assertThat(flags).isEmpty();
        FieldActivity name = monitor.getFields().get("name");
        assertThat(name.getFocusCount()).isEqualTo(2);
        assertThat(name.getInputCount()).isEqualTo(2);
        assertThat(name.getFirstFocusAt()).isEqualTo(1000L);
        assertThat(name.getLastActivityAt()).isEqualTo(3000L);
        assertThat(monitor.getFocusEvents()).isEqualTo(2);
        assertThat(monitor.getKeystrokes()).isEqualTo(2);
    }

    @Test
    void inputRightAfterFocus_isFastTyping() {
        List<FlagType> flags = record(focus("name", 1000), fieldInput("name", "J", 1040));

        assertThat(flags).containsExactly(FlagType.FAST_TYPING);
    }

    @Test
    void fastTyping_onlyCheckedOnFirstInput() {
        List<FlagType> flags = record(
                focus("name", 1000),
                fieldInput("name", "J", 1400),
                fieldInput("name", "Jo", 1410));

        assertThat(flags).isEmpty();
    }

    @Test
    void keyDownsCloserThanUniformThreshold_areFlagged() {
        List<FlagType> flags = record(keyDown(1000), keyDown(1030), keyDown(1200));

        assertThat(flags).containsExactly(FlagType.UNIFORM_TYPING);
    }

    @Test
    void fastClicks_areFlagged() {
        List<FlagType> flags = record(click(1000), click(1050), click(1400));

        assertThat(flags).containsExactly(FlagType.FAST_CLICKING);
    }

    @Test
    void paste_isFlagged() {
        List<InteractionEvent> events = List.of(paste("password", 24, 1000));
        List<Detection> detections = monitor.record(events.get(0), 1000);

        assertThat(detections).hasSize(1);
        assertThat(detections.get(0).getType()).isEqualTo(FlagType.PASTE_DETECTED);
        assertThat(detections.get(0).getData()).containsEntry("field", "password").containsEntry("dataLength", 24);
    }

    @Test
    void burstRightAfterPageReturns_isFlaggedOnce() {
        record(visibility(true, 1000), visibility(false, 5000));
        List<FlagType> flags = record(
                pointerMove(1, 1, 5001), pointerMove(2, 2, 5002), pointerMove(3, 3, 5003),
                pointerMove(4, 4, 5004), pointerMove(5, 5, 5005), pointerMove(6, 6, 5006),
                pointerMove(7, 7, 5007), pointerMove(8, 8, 5008));

        assertThat(flags).containsExactly(FlagType.RAPID_ACTIVITY_AFTER_FOCUS);
    }

    @Test
    void activityAfterWindow_isNotABurst() {
        record(visibility(false, 5000));
        List<FlagType> flags = record(
                pointerMove(1, 1, 5200), pointerMove(2, 2, 5210), pointerMove(3, 3, 5220),
                pointerMove(4, 4, 5230), pointerMove(5, 5, 5240), pointerMove(6, 6, 5250));

        assertThat(flags).isEmpty();
    }

    @Test
    void honeypotInput_isRememberedAndFlaggedOnce() {
        List<FlagType> flags = record(
                fieldInput("email_confirm", "", 1500),
                fieldInput("email_confirm", "bot@example.com", 2000),
                fieldInput("email_confirm", "bot@example.org", 2100));

        assertThat(monitor.getHoneypotValue()).isEqualTo("bot@example.org");
        assertThat(flags).containsExactly(FlagType.HONEYPOT_FILLED);
    }

    @Test
    void trackedFields_areBounded() {
        record(focus("a", 1), focus("b", 2), focus("c", 3), focus("d", 4));

        assertThat(monitor.getFieldInteractionCount()).isEqualTo(3);
        assertThat(monitor.getFields()).doesNotContainKey("d");
    }

    @Test
    void eventsWithoutPayload_areIgnored() {
        List<FlagType> flags = record(
                event(EventKind.FOCUS, 1000),
                event(EventKind.FIELD_INPUT, 1001),
                event(EventKind.POINTER_MOVE, 1002));

        assertThat(flags).isEmpty();
        assertThat(monitor.getFieldInteractionCount()).isZero();
        assertThat(monitor.getPointerMovements()).isZero();
    }
}
