package com.formshield.behavior.engine;

import com.formshield.behavior.model.Channel;
import com.formshield.behavior.model.Classification;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class FusionResult {
    private Map<Channel, Double> channelScores;
    private double overallScore;
    private Classification classification;
}
