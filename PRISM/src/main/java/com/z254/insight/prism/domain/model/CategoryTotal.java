package com.z254.insight.prism.domain.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One ranked row of an {@link AggregationTable}: a category, its total and its share of the grand total.
 */
@Value
public class CategoryTotal {

    int rank;

    String category;

    int total;

    /** Percentage of the grand total, scale 2, half-even */
    BigDecimal percentage;
}
