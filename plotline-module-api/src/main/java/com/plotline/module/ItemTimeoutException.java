package com.plotline.module;

import java.time.Duration;

/**
 * Thrown by {@link BoundedCall} when an item does not finish within its time bound.
 */
public class ItemTimeoutException extends RuntimeException {

    private final String itemId;
    private final Duration timeout;

    public ItemTimeoutException(String itemId, Duration timeout) {
        super("Item '" + itemId + "' timed out after " + timeout.toMillis() + " ms");
        this.itemId = itemId;
        this.timeout = timeout;
    }

    public String getItemId() {
        return itemId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
