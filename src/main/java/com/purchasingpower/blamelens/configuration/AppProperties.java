package com.purchasingpower.blamelens.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private CacheProperties cache = new CacheProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ProviderProperties gitlab = new ProviderProperties("https://gitlab.com");

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ProviderProperties github = new ProviderProperties("https://github.com");

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private HttpProperties http = new HttpProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private BlameProperties blame = new BlameProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RepositoryWatchProperties repositoryWatch = new RepositoryWatchProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ApiProperties api = new ApiProperties();
}
