package com.purchasingpower.blamelens.service.vcs;

import com.purchasingpower.blamelens.model.CallContext;
import com.purchasingpower.blamelens.model.ServiceType;
import com.purchasingpower.blamelens.model.dto.GitLabMergeRequest;
import com.purchasingpower.blamelens.model.vcs.ChangeRequest;
import com.purchasingpower.blamelens.model.vcs.ChangeRequestState;
import com.purchasingpower.blamelens.model.vcs.ChangeRequestStats;
import com.purchasingpower.blamelens.service.credential.CredentialStore;
import com.purchasingpower.blamelens.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * GitLab v4 API client.
 *
 * Uses {@code GET /projects/:id/repository/commits/:sha/merge_requests}, with the project
 * addressed by its URL-encoded path.
 */
@Slf4j
public class GitLabProviderClient extends AbstractProviderClient {

    public static final String ID = "gitlab";

    private static final ParameterizedTypeReference<List<GitLabMergeRequest>> MERGE_REQUEST_LIST =
            new ParameterizedTypeReference<>() {
            };

    public GitLabProviderClient(WebClient webClient, CredentialStore credentialStore,
                                String hostUrl, Duration requestTimeout) {
        super(webClient, credentialStore, hostUrl, requestTimeout);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "GitLab";
    }

    @Override
    protected String brandToken() {
        return "gitlab";
    }

    @Override
    protected void applyAuthentication(HttpHeaders headers, String token) {
        headers.set("PRIVATE-TOKEN", token);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    }

    @Override
    public Mono<ProviderResult<ChangeRequest>> resolveChangeRequest(String projectPath, String commitId,
                                                                    String hostOverride) {
        Optional<String> token = currentToken();
        if (token.isEmpty()) {
            return Mono.just(ProviderResult.failure(noCredential()));
        }

        URI uri = URI.create(projectApi(hostOverride, projectPath)
                + "/repository/commits/" + encode(commitId) + "/merge_requests");

        CallContext call = ExternalCallLogger.startCall(ServiceType.GITLAB, "CommitMergeRequests", log);
        call.logRequest("Merge requests containing commit",
                "Project", projectPath,
                "Commit", ExternalCallLogger.shortSha(commitId));

        return getJson(uri, token.get(), MERGE_REQUEST_LIST)
                .map(result -> result.map(mergeRequests -> ChangeRequestSelector.select(toChangeRequests(mergeRequests))))
                .doOnNext(result -> logResult(call, result));
    }

    @Override
    public Mono<ProviderResult<ChangeRequestStats>> fetchStats(String projectPath, long number, String hostOverride) {
        Optional<String> token = currentToken();
        if (token.isEmpty()) {
            return Mono.just(ProviderResult.failure(noCredential()));
        }

        URI uri = URI.create(projectApi(hostOverride, projectPath) + "/merge_requests/" + number);

        CallContext call = ExternalCallLogger.startCall(ServiceType.GITLAB, "MergeRequestStats", log);
        call.logRequest("Merge request size", "Project", projectPath, "IID", number);

        return getJson(uri, token.get(), GitLabMergeRequest.class)
                .map(result -> result.map(GitLabProviderClient::toStats))
                .doOnNext(result -> logResult(call, result));
    }

    private String projectApi(String hostOverride, String projectPath) {
        return resolveHost(hostOverride) + "/api/v4/projects/" + encode(projectPath);
    }

    static List<ChangeRequest> toChangeRequests(List<GitLabMergeRequest> mergeRequests) {
        if (mergeRequests == null) {
            return Collections.emptyList();
        }
        return mergeRequests.stream()
                .map(GitLabProviderClient::toChangeRequest)
                .collect(Collectors.toList());
    }

    static ChangeRequest toChangeRequest(GitLabMergeRequest mergeRequest) {
        return ChangeRequest.builder()
                .number(mergeRequest.getIid())
                .title(mergeRequest.getTitle())
                .url(mergeRequest.getWebUrl())
                .mergedAt(parseTimestamp(mergeRequest.getMergedAt()))
                .state(mapState(mergeRequest.getState()))
                .build();
    }

    static ChangeRequestState mapState(String state) {
        if (state == null) {
            return ChangeRequestState.CLOSED;
        }
        switch (state) {
            case "merged":
                return ChangeRequestState.MERGED;
            case "opened":
            case "locked":
                return ChangeRequestState.OPEN;
            default:
                return ChangeRequestState.CLOSED;
        }
    }

    private static ChangeRequestStats toStats(GitLabMergeRequest mergeRequest) {
        if (mergeRequest == null) {
            return null;
        }
        return ChangeRequestStats.builder()
                .changesCount(mergeRequest.getChangesCount())
                .build();
    }
}
