package com.darwinlink.domain.session;

public enum SessionMode {
    LIVE,
    SIMULATION
}
