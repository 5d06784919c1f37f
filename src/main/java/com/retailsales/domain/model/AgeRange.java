package com.retailsales.domain.model;

import lombok.Value;

/**
 * Inclusive customer age range.
 */
@Value(staticConstructor = "of")
public class AgeRange {
    int min;
    int max;
}
