package com.syncwatch.domain;

import java.time.Instant;

/**
 * Per-item completion signal reported by a status probe for one linked account.
 *
 * @param itemId         item (account) identifier
 * @param syncInProgress provider is still syncing the item
 * @param reauthRequired provider needs the user to re-authenticate the item's credential
 * @param lastSyncedAt   last successful sync, null if never synced
 */
public record ItemSyncSignal(String itemId, boolean syncInProgress, boolean reauthRequired, Instant lastSyncedAt) {

    /**
     * True when the item is idle, needs no re-auth and was synced at or after {@code since}.
     * An idle item untouched since {@code since} does not count.
     */
    public boolean isRefreshedSince(Instant since) {
        if (syncInProgress || reauthRequired || lastSyncedAt == null) {
            return false;
        }
        return since == null || !lastSyncedAt.isBefore(since);
    }
}
