package com.darwinlink.infrastructure.routing;

/**
 * Handle for removing a subscriber. Closing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
