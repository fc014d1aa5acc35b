package com.dealflow.core.model;

import java.io.Serializable;

/**
 * One step of a coordination plan.
 *
 * @param step                     1-based position in the plan
 * @param agent                    agent performing the step
 * @param dependsOn                agent whose step must finish first, or null
 * @param estimatedDurationSeconds rough duration estimate for scheduling displays
 */
public record CoordinationStep(
    int step,
    String agent,
    String dependsOn,
    int estimatedDurationSeconds
) implements Serializable {}
