package com.syncwatch.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ItemSyncSignalTest {

    private static final Instant START = Instant.parse("2026-01-10T12:00:00Z");

    @Test
    @DisplayName("idle item synced after start is refreshed")
    void syncedAfterStart() {
        assertThat(new ItemSyncSignal("a", false, false, START.plusSeconds(3)).isRefreshedSince(START)).isTrue();
    }

    @Test
    @DisplayName("item synced exactly at start counts as refreshed")
    void syncedAtStart() {
        assertThat(new ItemSyncSignal("a", false, false, START).isRefreshedSince(START)).isTrue();
    }

    @Test
    @DisplayName("idle item last synced before start is not refreshed")
    void idleButStale() {
        assertThat(new ItemSyncSignal("a", false, false, START.minusSeconds(60)).isRefreshedSince(START)).isFalse();
    }

    @Test
    @DisplayName("syncing, re-auth or never-synced items are not refreshed")
    void notRefreshedStates() {
        assertThat(new ItemSyncSignal("a", true, false, START.plusSeconds(1)).isRefreshedSince(START)).isFalse();
        assertThat(new ItemSyncSignal("a", false, true, START.plusSeconds(1)).isRefreshedSince(START)).isFalse();
        assertThat(new ItemSyncSignal("a", false, false, null).isRefreshedSince(START)).isFalse();
    }
}
