package com.di.insightengine.analytics.capacity;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CapacityRecommendation {
    RecommendationType type;
    RecommendationPriority priority;
    String description;
    String estimatedBenefit;
    String timeline;
}
