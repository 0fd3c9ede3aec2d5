package com.purchasingpower.blamelens.service.credential;

import com.purchasingpower.blamelens.configuration.AppProperties;
import com.purchasingpower.blamelens.event.CredentialChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-Memory Credential Store Tests")
class InMemoryCredentialStoreTest {

    private List<Object> events;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
    }

    @Test
    @DisplayName("Should seed tokens from configuration without publishing events")
    void testSeedFromProperties() {
        // Given
        AppProperties props = new AppProperties();
        props.getGitlab().setToken("  glpat-abc  ");
        props.getGithub().setToken("");

        // When
        InMemoryCredentialStore store = new InMemoryCredentialStore(props, events::add);

        // Then
        assertEquals("glpat-abc", store.getToken("gitlab").orElseThrow());
        assertTrue(store.hasCredential("gitlab"));
        assertFalse(store.hasCredential("github"));
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("Should publish a change event on set and delete")
    void testSetAndDelete() {
        InMemoryCredentialStore store = new InMemoryCredentialStore(events::add);

        store.setToken("github", "ghp_1");
        assertTrue(store.hasCredential("github"));

        store.deleteToken("github");
        assertFalse(store.hasCredential("github"));
        assertTrue(store.getToken("github").isEmpty());

        assertThat(events).containsExactly(
                new CredentialChangedEvent("github"),
                new CredentialChangedEvent("github"));
    }

    @Test
    @DisplayName("Should treat a blank token as removal")
    void testBlankTokenDeletes() {
        InMemoryCredentialStore store = new InMemoryCredentialStore(events::add);
        store.setToken("gitlab", "glpat-1");

        store.setToken("gitlab", "   ");

        assertFalse(store.hasCredential("gitlab"));
        assertEquals(2, events.size());
    }
}
