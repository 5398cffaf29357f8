package com.cartsafety.common.signal;

public enum SignalTier {
    STRONG,
    MODERATE,
    WEAK,
    NONE;

    public boolean isSignal() {
        return this != NONE;
    }
}
