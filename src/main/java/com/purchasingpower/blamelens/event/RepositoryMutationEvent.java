package com.purchasingpower.blamelens.event;

import java.nio.file.Path;

/**
 * Published after an operation that can rewrite history as seen locally: checkout, fetch,
 * pull or commit. Listeners treat it as "invalidate everything"; the repository is informational.
 *
 * @param repository work tree root, or null when the source does not know it (e.g. an external hook)
 * @param reason     short description for logs
 */
public record RepositoryMutationEvent(Path repository, String reason) {
}
