package com.purchasingpower.blamelens.service.vcs;

import com.purchasingpower.blamelens.model.CallContext;
import com.purchasingpower.blamelens.model.ServiceType;
import com.purchasingpower.blamelens.model.dto.GitHubCommit;
import com.purchasingpower.blamelens.model.dto.GitHubPullRequest;
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
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * GitHub REST API client.
 *
 * Looks up pull requests through {@code /repos/:owner/:repo/commits/:sha/pulls}. When that
 * returns nothing (squash or rebase merges whose commit is not associated with the PR), the
 * commit message is searched for a PR reference and that PR is loaded directly.
 */
@Slf4j
public class GitHubProviderClient extends AbstractProviderClient {

    public static final String ID = "github";

    private static final String PUBLIC_HOST = "github.com";

    // "Fix parser (#123)" as written by squash merges
    private static final Pattern SQUASH_REFERENCE = Pattern.compile("\\(#(\\d+)\\)");
    // "Merge pull request #123 from ..."
    private static final Pattern MERGE_REFERENCE = Pattern.compile("pull request #(\\d+)", Pattern.CASE_INSENSITIVE);

    private static final ParameterizedTypeReference<List<GitHubPullRequest>> PULL_REQUEST_LIST =
            new ParameterizedTypeReference<>() {
            };

    public GitHubProviderClient(WebClient webClient, CredentialStore credentialStore,
                                String hostUrl, Duration requestTimeout) {
        super(webClient, credentialStore, hostUrl, requestTimeout);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "GitHub";
    }

    @Override
    protected String brandToken() {
        return "github";
    }

    @Override
    protected void applyAuthentication(HttpHeaders headers, String token) {
        headers.set(HttpHeaders.AUTHORIZATION, "token " + token);
        headers.setAccept(List.of(MediaType.parseMediaType("application/vnd.github+json")));
    }

    @Override
    public Mono<ProviderResult<ChangeRequest>> resolveChangeRequest(String projectPath, String commitId,
                                                                    String hostOverride) {
        Optional<String> token = currentToken();
        if (token.isEmpty()) {
            return Mono.just(ProviderResult.failure(noCredential()));
        }

        String repositoryApi = repositoryApi(hostOverride, projectPath);
        URI pullsUri = URI.create(repositoryApi + "/commits/" + encode(commitId) + "/pulls");

        CallContext call = ExternalCallLogger.startCall(ServiceType.GITHUB, "CommitPullRequests", log);
        call.logRequest("Pull requests associated with commit",
                "Repository", projectPath,
                "Commit", ExternalCallLogger.shortSha(commitId));

        return getJson(pullsUri, token.get(), PULL_REQUEST_LIST)
                .flatMap(result -> {
                    if (!result.isSuccess()) {
                        return Mono.just(ProviderResult.<ChangeRequest>failure(result.getFailure()));
                    }
                    List<ChangeRequest> candidates = toChangeRequests(result.getValue());
                    if (!candidates.isEmpty()) {
                        return Mono.just(ProviderResult.<ChangeRequest>success(ChangeRequestSelector.select(candidates)));
                    }
                    return findFromCommitMessage(repositoryApi, commitId, token.get());
                })
                .doOnNext(result -> logResult(call, result));
    }

    @Override
    public Mono<ProviderResult<ChangeRequestStats>> fetchStats(String projectPath, long number, String hostOverride) {
        Optional<String> token = currentToken();
        if (token.isEmpty()) {
            return Mono.just(ProviderResult.failure(noCredential()));
        }

        URI uri = URI.create(repositoryApi(hostOverride, projectPath) + "/pulls/" + number);

        CallContext call = ExternalCallLogger.startCall(ServiceType.GITHUB, "PullRequestStats", log);
        call.logRequest("Pull request size", "Repository", projectPath, "Number", number);

        return getJson(uri, token.get(), GitHubPullRequest.class)
                .map(result -> result.map(GitHubProviderClient::toStats))
                .doOnNext(result -> logResult(call, result));
    }

    /**
     * Second phase of the lookup. Failures here are not reported; the commit simply has no
     * change request as far as the caller is concerned.
     */
    private Mono<ProviderResult<ChangeRequest>> findFromCommitMessage(String repositoryApi, String commitId,
                                                                       String token) {
        URI commitUri = URI.create(repositoryApi + "/commits/" + encode(commitId));

        return getJson(commitUri, token, GitHubCommit.class)
                .flatMap(result -> {
                    if (!result.isSuccess() || result.getValue() == null) {
                        log.debug("Commit {} could not be loaded for PR reference lookup",
                                ExternalCallLogger.shortSha(commitId));
                        return Mono.<Long>empty();
                    }
                    return Mono.justOrEmpty(extractPullRequestNumber(result.getValue().getMessageText()));
                })
                .flatMap(number -> getJson(URI.create(repositoryApi + "/pulls/" + number), token, GitHubPullRequest.class))
                .flatMap(result -> {
                    if (!result.isSuccess() || result.getValue() == null) {
                        return Mono.<ChangeRequest>empty();
                    }
                    GitHubPullRequest pullRequest = result.getValue();
                    return Mono.just(toChangeRequest(pullRequest).withStats(toStats(pullRequest)));
                })
                .map(ProviderResult::<ChangeRequest>success)
                .defaultIfEmpty(ProviderResult.success(null));
    }

    private String repositoryApi(String hostOverride, String projectPath) {
        return toApiUrl(resolveHost(hostOverride)) + "/repos/" + encodeRepositoryPath(projectPath);
    }

    /**
     * Maps the web host to the API host: {@code github.com} becomes {@code api.github.com},
     * Enterprise hosts get an {@code api.} prefix unless they already have one.
     */
    static String toApiUrl(String webUrl) {
        try {
            URI uri = new URI(webUrl);
            String host = uri.getHost();
            if (host == null) {
                return webUrl;
            }
            String scheme = uri.getScheme() != null ? uri.getScheme() : "https";
            String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
            String lowerHost = host.toLowerCase(Locale.ROOT);
            if (lowerHost.equals(PUBLIC_HOST)) {
                return "https://api.github.com";
            }
            if (lowerHost.startsWith("api.")) {
                return scheme + "://" + host + port;
            }
            return "https://api." + host + port;
        } catch (URISyntaxException e) {
            log.debug("Not a URL, using as API host: {}", webUrl);
            return webUrl;
        }
    }

    static Optional<Long> extractPullRequestNumber(String commitMessage) {
        if (commitMessage == null || commitMessage.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = SQUASH_REFERENCE.matcher(commitMessage);
        if (!matcher.find()) {
            matcher = MERGE_REFERENCE.matcher(commitMessage);
            if (!matcher.find()) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    // owner and repo are separate path segments on GitHub, so the slash between them is kept
    private static String encodeRepositoryPath(String projectPath) {
        return Arrays.stream(projectPath.split("/"))
                .map(AbstractProviderClient::encode)
                .collect(Collectors.joining("/"));
    }

    static List<ChangeRequest> toChangeRequests(List<GitHubPullRequest> pullRequests) {
        if (pullRequests == null) {
            return Collections.emptyList();
        }
        return pullRequests.stream()
                .map(GitHubProviderClient::toChangeRequest)
                .collect(Collectors.toList());
    }

    static ChangeRequest toChangeRequest(GitHubPullRequest pullRequest) {
        return ChangeRequest.builder()
                .number(pullRequest.getNumber())
                .title(pullRequest.getTitle())
                .url(pullRequest.getHtmlUrl())
                .mergedAt(parseTimestamp(pullRequest.getMergedAt()))
                .state(mapState(pullRequest))
                .build();
    }

    static ChangeRequestState mapState(GitHubPullRequest pullRequest) {
        if (pullRequest.getMergedAt() != null) {
            return ChangeRequestState.MERGED;
        }
        return "open".equals(pullRequest.getState()) ? ChangeRequestState.OPEN : ChangeRequestState.CLOSED;
    }

    private static ChangeRequestStats toStats(GitHubPullRequest pullRequest) {
        if (pullRequest == null || pullRequest.getAdditions() == null) {
            return null;
        }
        return ChangeRequestStats.builder()
                .additions(pullRequest.getAdditions())
                .deletions(pullRequest.getDeletions())
                .changedFiles(pullRequest.getChangedFiles())
                .build();
    }
}
