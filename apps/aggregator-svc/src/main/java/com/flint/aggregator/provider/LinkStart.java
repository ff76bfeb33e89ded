package com.flint.aggregator.provider;

public record LinkStart(String url, String callbackUrl) {
}
