package net.solidcore.container.di;

/**
 * Lifetime policy of a registration.
 */
public enum Lifetime {

    /**
     * A new object graph is created on every resolution.
     */
    TRANSIENT,

    /**
     * One instance is created on first resolution and reused afterwards.
     */
    SINGLETON
}
