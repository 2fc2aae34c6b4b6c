package com.formshield.behavior.engine;

import com.formshield.behavior.model.ClickFeatures;
import com.formshield.behavior.model.KeyboardFeatures;
import com.formshield.behavior.model.PointerFeatures;
import com.formshield.behavior.model.TimingFeatures;
import com.formshield.behavior.model.TouchFeatures;
import lombok.Builder;
import lombok.Data;

/**
 * Features from all five accumulators, taken at one instant and handed to every channel scorer.
 */
@Data
@Builder
public class SessionFeatures {
    private PointerFeatures pointer;
    private TouchFeatures touch;
    private ClickFeatures click;
    private KeyboardFeatures keyboard;
    private TimingFeatures timing;
}
