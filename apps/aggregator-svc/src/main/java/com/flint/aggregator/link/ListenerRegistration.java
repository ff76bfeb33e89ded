package com.flint.aggregator.link;

@FunctionalInterface
public interface ListenerRegistration {

    void remove();
}
