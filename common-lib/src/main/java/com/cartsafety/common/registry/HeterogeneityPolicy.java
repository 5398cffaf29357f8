package com.cartsafety.common.registry;

/**
 * How the random-effects estimator treats studies of different product classes.
 */
public enum HeterogeneityPolicy {
    /** Pool, reporting heterogeneity metrics and a warning. */
    ANNOTATE,
    /** Refuse to pool more than one product class. */
    REJECT_MIXED_CLASSES
}
