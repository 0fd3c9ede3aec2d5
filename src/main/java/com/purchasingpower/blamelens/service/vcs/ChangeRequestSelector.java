package com.purchasingpower.blamelens.service.vcs;

import com.purchasingpower.blamelens.model.vcs.ChangeRequest;

import java.util.Comparator;
import java.util.List;

/**
 * Picks one change request when a provider returns several for a commit.
 *
 * <p>The earliest merged one wins: that is the change request that first brought the commit into
 * the target branch. Without any merged candidate the first one in provider order is used.
 */
public final class ChangeRequestSelector {

    private ChangeRequestSelector() {
    }

    public static ChangeRequest select(List<ChangeRequest> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        // Stream.sorted is stable, so equal merge times keep provider order
        return candidates.stream()
                .filter(ChangeRequest::isMerged)
                .sorted(Comparator.comparing(ChangeRequest::getMergedAt))
                .findFirst()
                .orElse(candidates.get(0));
    }
}
