package com.purchasingpower.blamelens.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusResponse {

    private List<ProviderStatus> providers;
    private int cacheSize;
    private long cacheTtlSeconds;
    private int inFlight;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProviderStatus {
        private String id;
        private String name;
        private String hostUrl;
        private boolean hasCredential;
    }
}
