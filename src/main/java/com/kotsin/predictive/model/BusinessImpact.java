package com.kotsin.predictive.model;

import lombok.Value;

/**
 * Heuristic three-axis impact score. risk and opportunity are bounded to [0, 100];
 * revenue is unbounded.
 */
@Value
public class BusinessImpact {
    long revenue;
    int risk;
    int opportunity;
}
