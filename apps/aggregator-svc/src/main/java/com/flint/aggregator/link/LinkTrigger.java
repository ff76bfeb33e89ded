package com.flint.aggregator.link;

/**
 * What ended a link flow. None of these says whether the provider side succeeded.
 */
public enum LinkTrigger {
    POPUP_CLOSED,
    BROWSER_DISMISSED,
    DEEP_LINK
}
