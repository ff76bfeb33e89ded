package com.flint.aggregator.link;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * One link attempt. A {@code null} timeout means the configured ceiling; callbacks are optional and
 * run before the returned future completes.
 */
public record LinkFlowOptions(
        String url,
        LinkTransport transport,
        String windowName,
        String windowFeatures,
        Duration timeout,
        Consumer<LinkCompletion> onComplete,
        Consumer<LinkFlowException> onError
) {

    public static final String DEFAULT_WINDOW_NAME = "_blank";
    public static final String DEFAULT_WINDOW_FEATURES = "width=600,height=700";

    public LinkFlowOptions {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must be provided");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport must be provided");
        }
        if (windowName == null || windowName.isBlank()) {
            windowName = DEFAULT_WINDOW_NAME;
        }
        if (windowFeatures == null) {
            windowFeatures = DEFAULT_WINDOW_FEATURES;
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static LinkFlowOptions popup(String url) {
        return new LinkFlowOptions(url, LinkTransport.POPUP, null, null, null, null, null);
    }

    public static LinkFlowOptions mobile(String url) {
        return new LinkFlowOptions(url, LinkTransport.MOBILE_DEEPLINK, null, null, null, null, null);
    }

    public LinkFlowOptions withCallbacks(Consumer<LinkCompletion> completed, Consumer<LinkFlowException> failed) {
        return new LinkFlowOptions(url, transport, windowName, windowFeatures, timeout, completed, failed);
    }

    public LinkFlowOptions withTimeout(Duration newTimeout) {
        return new LinkFlowOptions(url, transport, windowName, windowFeatures, newTimeout, onComplete, onError);
    }
}
