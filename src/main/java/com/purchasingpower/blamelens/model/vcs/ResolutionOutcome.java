package com.purchasingpower.blamelens.model.vcs;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Result of resolving one line to a change request.
 *
 * <ul>
 *   <li>{@code checked && changeRequest != null}: resolved</li>
 *   <li>{@code checked && changeRequest == null}: resolved, the commit has no change request</li>
 *   <li>{@code loading}: another request for the same commit is in flight</li>
 *   <li>neither: not resolved (no remote, no credential, provider failure, or cancelled)</li>
 * </ul>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResolutionOutcome {

    private static final ResolutionOutcome LOADING = new ResolutionOutcome(null, false, true);
    private static final ResolutionOutcome UNCHECKED = new ResolutionOutcome(null, false, false);

    ChangeRequest changeRequest;
    boolean checked;
    boolean loading;

    public static ResolutionOutcome resolved(ChangeRequest changeRequest) {
        return new ResolutionOutcome(changeRequest, true, false);
    }

    public static ResolutionOutcome loading() {
        return LOADING;
    }

    public static ResolutionOutcome unchecked() {
        return UNCHECKED;
    }

    public Optional<ChangeRequest> findChangeRequest() {
        return Optional.ofNullable(changeRequest);
    }
}
