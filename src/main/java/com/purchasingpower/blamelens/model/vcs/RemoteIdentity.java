package com.purchasingpower.blamelens.model.vcs;

import lombok.Value;

/**
 * Host and project path parsed from a git remote URL.
 *
 * <p>Example: {@code git@gitlab.example.com:backend/services/api.git} becomes
 * {@code hostUrl=https://gitlab.example.com}, {@code projectPath=backend/services/api}.
 */
@Value
public class RemoteIdentity {
    String hostUrl;
    String projectPath;
}
