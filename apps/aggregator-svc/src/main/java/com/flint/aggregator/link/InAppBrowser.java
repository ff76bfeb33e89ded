package com.flint.aggregator.link;

/**
 * System browser view of the mobile shell. It does not close itself when the app is re-entered
 * through a deep link.
 */
public interface InAppBrowser {

    void open(String url);

    void close();

    ListenerRegistration addFinishedListener(Runnable listener);
}
