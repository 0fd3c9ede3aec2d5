package com.purchasingpower.blamelens.model.vcs;

import lombok.Builder;
import lombok.Value;

/**
 * Size of a change request.
 *
 * GitHub reports additions, deletions and changed files. GitLab only reports a
 * {@code changesCount}, which may be capped (e.g. "1000+").
 */
@Value
@Builder
public class ChangeRequestStats {
    Integer additions;
    Integer deletions;
    Integer changedFiles;
    String changesCount;
}
