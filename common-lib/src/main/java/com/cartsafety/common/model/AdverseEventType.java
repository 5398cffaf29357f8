package com.cartsafety.common.model;

/**
 * Immunologic adverse events tracked for cell therapies. Stored as an explicit field
 * on every observation; never inferred from free text.
 */
public enum AdverseEventType {
    /** Cytokine release syndrome. */
    CRS,
    /** Immune effector cell-associated neurotoxicity syndrome. */
    ICANS,
    /** Haemophagocytic lymphohistiocytosis. */
    HLH,
    /** Immune effector cell-associated HLH-like syndrome. */
    ICAHS,
    /** Local immune effector cell-associated toxicity syndrome. */
    LICATS
}
