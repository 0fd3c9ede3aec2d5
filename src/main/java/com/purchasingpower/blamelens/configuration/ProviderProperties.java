package com.purchasingpower.blamelens.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-host settings for one hosting provider.
 *
 * <p>{@code baseUrl} is the web URL of the instance (e.g. {@code https://gitlab.example.com}).
 * Self-hosted instances whose hostname does not contain the provider's name are matched
 * against this host. {@code token} seeds the credential store at startup and may be empty.
 */
@Data
@NoArgsConstructor
public class ProviderProperties {

    @NotBlank
    private String baseUrl;

    private String token;

    public ProviderProperties(String baseUrl) {
        this.baseUrl = baseUrl;
    }
}
