package com.purchasingpower.blamelens.service.resolution;

import com.purchasingpower.blamelens.service.vcs.FailureKind;
import com.purchasingpower.blamelens.service.vcs.ProviderFailure;
import com.purchasingpower.blamelens.service.vcs.ProviderIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void onProviderFailure(ProviderFailure failure, ProviderIdentity provider) {
        if (!failure.isShouldNotifyUser()) {
            log.debug("{} lookup failed: {} ({})", provider.getDisplayName(), failure.getKind(), failure.getMessage());
            return;
        }
        if (failure.getKind() == FailureKind.NO_CREDENTIAL) {
            log.warn("⚠️ No {} token configured. Set one with PUT /api/v1/credentials/{}",
                    provider.getDisplayName(), provider.getId());
        } else {
            log.warn("⚠️ {} rejected the token ({}). Replace it with PUT /api/v1/credentials/{}",
                    provider.getDisplayName(), failure.getMessage(), provider.getId());
        }
    }
}
