package com.flint.aggregator.link;

/**
 * Desktop shell able to open a popup window.
 */
public interface PopupWindowHost {

    /**
     * @return the window handle, or {@code null} when the popup was blocked
     */
    PopupWindow open(String url, String windowName, String windowFeatures);
}
