package com.purchasingpower.blamelens.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

import java.time.Duration;

@Data
public class HttpProperties {

    /**
     * Upper bound for a single provider API call. A call that exceeds it is reported as a network error.
     */
    @Min(100)
    private long timeoutMs = 10_000;

    public Duration getTimeout() {
        return Duration.ofMillis(timeoutMs);
    }
}
