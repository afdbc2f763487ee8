package com.syncwatch.refresh.probe;

import com.syncwatch.domain.ItemSyncSignal;

import java.util.List;

/**
 * Reports per-item sync signals for linked accounts. Provider protocol (GraphQL, REST, ...) is up to the
 * implementation. Failures are raised as {@link ProbeException}; any other runtime exception is treated
 * as non-retryable.
 */
public interface StatusProbe {

    /**
     * @param itemIds items to check; never empty
     * @return one signal per item the provider knows about; items may be missing
     */
    List<ItemSyncSignal> check(List<String> itemIds);
}
