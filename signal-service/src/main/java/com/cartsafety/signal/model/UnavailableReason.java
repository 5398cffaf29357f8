package com.cartsafety.signal.model;

public enum UnavailableReason {
    TIMEOUT,
    RATE_LIMITED,
    SOURCE_ERROR
}
