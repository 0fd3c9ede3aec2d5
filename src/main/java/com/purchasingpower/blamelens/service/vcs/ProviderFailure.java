package com.purchasingpower.blamelens.service.vcs;

import lombok.Builder;
import lombok.Value;

/**
 * A typed provider failure.
 *
 * <p>{@code shouldNotifyUser} is set on the first credential failure a provider reports and
 * stays false until the provider's notification state is reset.
 */
@Value
@Builder
public class ProviderFailure {
    FailureKind kind;
    String message;
    /** HTTP status, null for failures that happened before or outside an HTTP exchange. */
    Integer statusCode;
    boolean shouldNotifyUser;
}
