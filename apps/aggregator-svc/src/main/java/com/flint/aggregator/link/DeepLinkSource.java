package com.flint.aggregator.link;

import java.util.function.Consumer;

/**
 * Inbound app URLs, delivered whatever their scheme.
 */
public interface DeepLinkSource {

    ListenerRegistration addListener(Consumer<String> listener);
}
