package com.purchasingpower.blamelens.service.resolution;

import com.purchasingpower.blamelens.event.RepositoryMutationEvent;
import com.purchasingpower.blamelens.model.blame.LineAttribution;
import com.purchasingpower.blamelens.model.vcs.ChangeRequest;
import com.purchasingpower.blamelens.model.vcs.ChangeRequestState;
import com.purchasingpower.blamelens.model.vcs.ChangeRequestStats;
import com.purchasingpower.blamelens.model.vcs.LineResolution;
import com.purchasingpower.blamelens.model.vcs.ResolutionOutcome;
import com.purchasingpower.blamelens.service.cache.MutableClock;
import com.purchasingpower.blamelens.service.cache.ResolutionCache;
import com.purchasingpower.blamelens.service.git.BlameParser;
import com.purchasingpower.blamelens.service.git.BlameService;
import com.purchasingpower.blamelens.service.git.RemoteUrlLocator;
import com.purchasingpower.blamelens.service.vcs.FailureKind;
import com.purchasingpower.blamelens.service.vcs.ProviderFailure;
import com.purchasingpower.blamelens.service.vcs.ProviderRegistry;
import com.purchasingpower.blamelens.service.vcs.ProviderResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Resolution Engine Tests")
class ResolutionEngineTest {

    private static final Path FILE = Path.of("/work/widgets/src/App.java");
    private static final String COMMIT = "a1b2c3d4e5f6a7b8c9d0a1b2c3d4e5f6a7b8c9d0";
    private static final LineAttribution ATTRIBUTION = LineAttribution.builder()
            .commitId(COMMIT)
            .author("Alice")
            .lineNumber(1)
            .build();

    private StubProviderClient gitLab;
    private StubProviderClient gitHub;
    private ResolutionCache cache;
    private List<ProviderFailure> notifications;
    private String remoteUrl;
    private String blameOutput;
    private ResolutionEngine engine;

    @BeforeEach
    void setUp() {
        gitLab = new StubProviderClient("gitlab");
        gitHub = new StubProviderClient("github");
        cache = new ResolutionCache(Duration.ofHours(1), new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
        notifications = new CopyOnWriteArrayList<>();
        remoteUrl = "git@gitlab.com:group/widgets.git";
        blameOutput = "";

        RemoteUrlLocator locator = new RemoteUrlLocator() {
            @Override
            public Optional<String> findRemoteUrl(Path file) {
                return Optional.ofNullable(remoteUrl);
            }

            @Override
            public Set<Path> getKnownRepositories() {
                return Set.of();
            }
        };
        BlameService blameService = new BlameService(file -> blameOutput, new BlameParser());

        engine = new ResolutionEngine(
                new ProviderRegistry(List.of(gitLab, gitHub)),
                cache,
                locator,
                (failure, provider) -> notifications.add(failure),
                blameService,
                Runnable::run);
    }

    @Test
    @DisplayName("Should hit the network once for repeated resolution of a commit")
    void testRepeatedResolutionUsesCache() {
        // Given
        gitLab.answer(ProviderResult.success(changeRequest(7)));

        // When
        ResolutionOutcome first = engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();
        ResolutionOutcome second = engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();

        // Then
        assertEquals(1, gitLab.resolveCalls.get());
        assertTrue(first.isChecked());
        assertEquals(7, first.getChangeRequest().getNumber());
        assertTrue(second.isChecked());
        assertEquals(first.getChangeRequest(), second.getChangeRequest());
        assertEquals(List.of("https://gitlab.com"), gitLab.hostOverrides, "Remote host is passed as override");
        assertEquals(0, gitHub.resolveCalls.get());
    }

    @Test
    @DisplayName("Should cache a commit without change request as checked null")
    void testNoChangeRequestIsCached() {
        gitLab.answer(ProviderResult.success(null));

        ResolutionOutcome first = engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();
        ResolutionOutcome second = engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();

        assertTrue(first.isChecked());
        assertNull(first.getChangeRequest());
        assertTrue(second.isChecked());
        assertTrue(cache.has("gitlab", COMMIT));
        assertEquals(1, gitLab.resolveCalls.get());
    }

    @Test
    @DisplayName("Should answer loading while the same commit is in flight")
    void testInFlightAnswersLoading() {
        // Given
        CompletableFuture<ProviderResult<ChangeRequest>> pending = gitLab.answerLater();
        CompletableFuture<ResolutionOutcome> first = engine.resolve(FILE, ATTRIBUTION, CancellationToken.none());

        // When
        ResolutionOutcome second = engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();

        // Then
        assertTrue(second.isLoading());
        assertFalse(second.isChecked());
        assertFalse(first.isDone());
        assertEquals(1, engine.inFlightCount());

        // When
        pending.complete(ProviderResult.success(changeRequest(9)));

        // Then
        assertEquals(9, first.join().getChangeRequest().getNumber());
        assertEquals(0, engine.inFlightCount());
        assertEquals(1, gitLab.resolveCalls.get());
    }

    @Test
    @DisplayName("Should discard a result that settles after cancellation")
    void testCancellationAfterSettle() {
        // Given
        CompletableFuture<ProviderResult<ChangeRequest>> pending = gitLab.answerLater();
        CancellationToken token = new CancellationToken();
        CompletableFuture<ResolutionOutcome> outcome = engine.resolve(FILE, ATTRIBUTION, token);

        // When
        token.cancel();

        // Then: the caller is released immediately
        assertTrue(outcome.isDone());
        assertFalse(outcome.join().isChecked());
        assertNull(outcome.join().getChangeRequest());

        // When: the provider answers afterwards
        pending.complete(ProviderResult.success(changeRequest(5)));

        // Then: nothing is written or reported
        assertFalse(cache.has("gitlab", COMMIT));
        assertEquals(0, engine.inFlightCount());
        assertTrue(notifications.isEmpty());
    }

    @Test
    @DisplayName("Should not notify about failures of cancelled requests")
    void testCancelledFailureIsNotNotified() {
        CompletableFuture<ProviderResult<ChangeRequest>> pending = gitLab.answerLater();
        CancellationToken token = new CancellationToken();
        engine.resolve(FILE, ATTRIBUTION, token);

        token.cancel();
        pending.complete(ProviderResult.failure(failure(FailureKind.INVALID_CREDENTIAL, true)));

        assertTrue(notifications.isEmpty());
        assertFalse(cache.has("gitlab", COMMIT));
    }

    @Test
    @DisplayName("Should cache failures as null and forward them to the notification sink")
    void testFailureIsCachedAndNotified() {
        // Given
        ProviderFailure failure = failure(FailureKind.RATE_LIMITED, false);
        gitLab.answer(ProviderResult.failure(failure));

        // When
        ResolutionOutcome first = engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();
        ResolutionOutcome second = engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();

        // Then
        assertFalse(first.isChecked());
        assertNull(first.getChangeRequest());
        assertEquals(List.of(failure), notifications);
        assertTrue(second.isChecked(), "The cached null is served afterwards");
        assertEquals(1, gitLab.resolveCalls.get());
    }

    @Test
    @DisplayName("Should answer unchecked without caching when configuration is incomplete")
    void testIncompleteConfiguration() {
        // No remote
        remoteUrl = null;
        assertUncheckedWithoutCall();

        // Remote of an unknown host
        remoteUrl = "https://bitbucket.org/team/widgets.git";
        assertUncheckedWithoutCall();

        // Provider without credential
        remoteUrl = "git@gitlab.com:group/widgets.git";
        gitLab.credential = false;
        assertUncheckedWithoutCall();

        // Remote without project path
        gitLab.credential = true;
        remoteUrl = "https://gitlab.com/";
        assertUncheckedWithoutCall();
    }

    @Test
    @DisplayName("Should keep providers apart in the cache")
    void testProviderIsolation() {
        gitLab.answer(ProviderResult.success(changeRequest(1)));
        gitHub.answer(ProviderResult.success(changeRequest(2)));

        engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();
        remoteUrl = "https://github.com/octo/widgets.git";
        ResolutionOutcome fromGitHub = engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();

        assertEquals(2, fromGitHub.getChangeRequest().getNumber());
        assertEquals(1, gitHub.resolveCalls.get());
        assertEquals(1, cache.get("gitlab", COMMIT).orElseThrow().getValue().getNumber());
    }

    @Test
    @DisplayName("Should resolve again after a repository mutation wipes the cache")
    void testMutationForcesNewLookup() {
        gitLab.answer(ProviderResult.success(changeRequest(1)));
        engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();

        cache.onRepositoryMutation(new RepositoryMutationEvent(null, "pull"));
        engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();

        assertEquals(2, gitLab.resolveCalls.get());
    }

    @Test
    @DisplayName("Should blame the line and resolve its commit")
    void testResolveByLine() {
        // Given
        blameOutput = String.join("\n",
                COMMIT + " 1 1 1",
                "author Alice",
                "summary Add app",
                "\tclass App {}",
                "0000000000000000000000000000000000000000 2 2 1",
                "author Not Committed Yet",
                "\t// dirty");
        gitLab.answer(ProviderResult.success(changeRequest(3)));

        // When
        LineResolution committed = engine.resolve(FILE, 1, CancellationToken.none()).join();
        LineResolution uncommitted = engine.resolve(FILE, 2, CancellationToken.none()).join();

        // Then
        assertEquals(COMMIT, committed.getAttribution().getCommitId());
        assertEquals("Add app", committed.getAttribution().getSummary());
        assertEquals(3, committed.getOutcome().getChangeRequest().getNumber());

        assertNull(uncommitted.getAttribution());
        assertFalse(uncommitted.getOutcome().isChecked());
        assertEquals(1, gitLab.resolveCalls.get());
    }

    @Test
    @DisplayName("Should load stats once and keep them in the cache")
    void testLoadStats() {
        // Given
        gitLab.answer(ProviderResult.success(changeRequest(4)));
        engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();
        gitLab.statsAnswer = ProviderResult.success(ChangeRequestStats.builder().changesCount("12").build());

        // When
        Optional<ChangeRequest> first = engine.loadStats(FILE, ATTRIBUTION).join();
        Optional<ChangeRequest> second = engine.loadStats(FILE, ATTRIBUTION).join();

        // Then
        assertEquals("12", first.orElseThrow().getStats().getChangesCount());
        assertEquals("12", second.orElseThrow().getStats().getChangesCount());
        assertEquals(1, gitLab.statsCalls.get());
        assertEquals("12", cache.get("gitlab", COMMIT).orElseThrow().getValue().getStats().getChangesCount());
    }

    @Test
    @DisplayName("Should return nothing from loadStats when no change request is cached")
    void testLoadStats_NothingCached() {
        assertTrue(engine.loadStats(FILE, ATTRIBUTION).join().isEmpty());
        assertEquals(0, gitLab.statsCalls.get());

        // A failed stats call still returns the change request
        gitLab.answer(ProviderResult.success(changeRequest(4)));
        engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();
        gitLab.statsAnswer = ProviderResult.failure(failure(FailureKind.NOT_FOUND, false));

        ChangeRequest withoutStats = engine.loadStats(FILE, ATTRIBUTION).join().orElseThrow();
        assertNull(withoutStats.getStats());
    }

    private void assertUncheckedWithoutCall() {
        ResolutionOutcome outcome = engine.resolve(FILE, ATTRIBUTION, CancellationToken.none()).join();

        assertFalse(outcome.isChecked(), "Remote " + remoteUrl);
        assertFalse(outcome.isLoading());
        assertEquals(0, gitLab.resolveCalls.get() + gitHub.resolveCalls.get());
        assertEquals(0, cache.size());
    }

    private static ProviderFailure failure(FailureKind kind, boolean notify) {
        return ProviderFailure.builder().kind(kind).message(kind.name()).shouldNotifyUser(notify).build();
    }

    private static ChangeRequest changeRequest(long number) {
        return ChangeRequest.builder()
                .number(number)
                .title("Change " + number)
                .url("https://gitlab.com/group/widgets/-/merge_requests/" + number)
                .state(ChangeRequestState.MERGED)
                .mergedAt(Instant.parse("2024-06-01T10:00:00Z"))
                .build();
    }
}
