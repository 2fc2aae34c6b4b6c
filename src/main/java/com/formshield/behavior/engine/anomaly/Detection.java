package com.formshield.behavior.engine.anomaly;

import com.formshield.behavior.model.FlagType;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * A condition found by one of the anomaly checks, before it is turned into a penalized flag.
 */
@Value
public class Detection {
    FlagType type;
    Map<String, Object> data;

    public static Detection of(FlagType type) {
        return new Detection(type, Collections.emptyMap());
    }

    public static Detection of(FlagType type, Map<String, Object> data) {
        return new Detection(type, data == null ? Collections.emptyMap() : data);
    }
}
