package com.purchasingpower.blamelens.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ApiProperties {

    /**
     * How long a REST resolve request waits before it gives up and answers "loading".
     */
    @Min(1)
    private long resolveTimeoutMs = 3_000;
}
