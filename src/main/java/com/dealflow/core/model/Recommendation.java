package com.dealflow.core.model;

import java.io.Serializable;

/**
 * An operator-facing suggestion derived from decision history.
 */
public record Recommendation(
    String type,
    String description,
    String priority
) implements Serializable {}
