package com.flint.aggregator.link;

public interface PopupWindow {

    boolean isClosed();

    void close();
}
