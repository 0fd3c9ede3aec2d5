package com.purchasingpower.blamelens.service.vcs;

import com.purchasingpower.blamelens.model.vcs.ChangeRequest;
import com.purchasingpower.blamelens.model.vcs.ChangeRequestStats;
import com.purchasingpower.blamelens.model.vcs.RemoteIdentity;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Client for one kind of hosting provider (GitLab, GitHub, ...).
 *
 * <p>Implementations never emit errors from the returned {@link Mono}s; every failure mode is a
 * {@link ProviderResult#failure(ProviderFailure)}.
 */
public interface ProviderClient extends ProviderIdentity {

    /**
     * Web URL of the configured instance, e.g. {@code https://gitlab.com}.
     */
    String getHostUrl();

    /**
     * @return true if the remote's host belongs to this provider
     */
    boolean isProviderUrl(String remoteUrl);

    /**
     * @return host and project path, or empty if the URL is not this provider's or has no project path
     */
    Optional<RemoteIdentity> parseRemoteUrl(String remoteUrl);

    /**
     * Find the change request that landed {@code commitId}.
     *
     * @param projectPath  project path, e.g. "group/project"
     * @param commitId     full or abbreviated commit id
     * @param hostOverride host URL to query instead of {@link #getHostUrl()}, may be null
     * @return success with the change request, success with null if there is none, or a failure
     */
    Mono<ProviderResult<ChangeRequest>> resolveChangeRequest(String projectPath, String commitId, String hostOverride);

    /**
     * Load size statistics for a change request found earlier.
     */
    Mono<ProviderResult<ChangeRequestStats>> fetchStats(String projectPath, long number, String hostOverride);

    /**
     * Allow the next credential failure to be reported to the user again.
     * Called whenever this provider's credential changes.
     */
    void resetNotificationState();
}
