package com.purchasingpower.blamelens.api;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * New cache TTL. Zero or less disables caching.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheTtlRequest {

    @NotNull
    private Long ttlSeconds;
}
