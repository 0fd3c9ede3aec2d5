package com.purchasingpower.blamelens.config;

import com.purchasingpower.blamelens.configuration.AppProperties;
import com.purchasingpower.blamelens.service.credential.CredentialStore;
import com.purchasingpower.blamelens.service.vcs.GitHubProviderClient;
import com.purchasingpower.blamelens.service.vcs.GitLabProviderClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Hosting provider clients.
 *
 * <p>The {@code @Order} values fix the detection order in the registry: GitLab, then GitHub.
 * Each client gets its own {@link WebClient} built from Boot's shared builder so codecs and
 * customizers are applied consistently.
 */
@Slf4j
@Configuration
public class ProviderClientConfig {

    @Bean
    @Order(1)
    public GitLabProviderClient gitLabProviderClient(WebClient.Builder builder, AppProperties props,
                                                     CredentialStore credentialStore) {
        String baseUrl = props.getGitlab().getBaseUrl();
        log.info("GitLab provider configured for {}", baseUrl);
        return new GitLabProviderClient(builder.clone().build(), credentialStore, baseUrl,
                props.getHttp().getTimeout());
    }

    @Bean
    @Order(2)
    public GitHubProviderClient gitHubProviderClient(WebClient.Builder builder, AppProperties props,
                                                     CredentialStore credentialStore) {
        String baseUrl = props.getGithub().getBaseUrl();
        log.info("GitHub provider configured for {}", baseUrl);
        return new GitHubProviderClient(builder.clone().build(), credentialStore, baseUrl,
                props.getHttp().getTimeout());
    }
}
