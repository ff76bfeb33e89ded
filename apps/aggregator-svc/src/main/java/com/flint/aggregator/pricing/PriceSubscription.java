package com.flint.aggregator.pricing;

@FunctionalInterface
public interface PriceSubscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
