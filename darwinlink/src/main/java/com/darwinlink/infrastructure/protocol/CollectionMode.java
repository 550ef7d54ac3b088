package com.darwinlink.infrastructure.protocol;

/**
 * How many lines make up one response.
 */
public enum CollectionMode {
    SINGLE,     // First accepted line
    LIST,       // Accepted lines until the stream goes quiet for the settle window
    FRAMED      // Lines between BEGIN DATA and END DATA
}
