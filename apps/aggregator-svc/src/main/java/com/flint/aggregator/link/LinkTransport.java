package com.flint.aggregator.link;

public enum LinkTransport {
    POPUP,
    MOBILE_DEEPLINK
}
