package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnomalyContext {
    SystemLayer systemLayer;
    String component;
    @Singular
    List<String> correlatedEvents;
}
