package com.purchasingpower.blamelens.service.resolution;

import com.purchasingpower.blamelens.service.vcs.ProviderFailure;
import com.purchasingpower.blamelens.service.vcs.ProviderIdentity;

/**
 * Receives provider failures of resolutions whose caller was still waiting.
 * Whether to bother the user is decided by {@link ProviderFailure#isShouldNotifyUser()}.
 */
public interface NotificationSink {

    void onProviderFailure(ProviderFailure failure, ProviderIdentity provider);
}
