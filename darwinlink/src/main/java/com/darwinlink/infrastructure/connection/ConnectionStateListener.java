package com.darwinlink.infrastructure.connection;

import com.darwinlink.domain.session.LivenessState;

@FunctionalInterface
public interface ConnectionStateListener {

    void onStateChange(Endpoint endpoint, LivenessState from, LivenessState to);
}
