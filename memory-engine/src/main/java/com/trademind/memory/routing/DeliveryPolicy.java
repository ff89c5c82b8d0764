package com.trademind.memory.routing;

import com.trademind.common.exception.ConfigurationException;

import java.time.Duration;

/** Per-subscriber notification timeout and the number of immediate retries after a failure. */
public record DeliveryPolicy(Duration timeout, int retries) {

    public DeliveryPolicy {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new ConfigurationException("delivery timeout must be positive");
        }
        if (retries < 0) {
            throw new ConfigurationException("delivery retries must be non-negative: " + retries);
        }
    }

    public static DeliveryPolicy defaults() {
        return new DeliveryPolicy(Duration.ofSeconds(2), 1);
    }
}
