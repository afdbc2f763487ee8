package com.syncwatch.refresh.service;

import java.util.List;

/**
 * Asks the provider to start refreshing the given items. Returns once the request is accepted;
 * completion is observed separately through a status probe.
 */
public interface RefreshInitiator {

    /**
     * @throws RefreshRejectedException when the provider does not accept the request
     */
    void requestRefresh(List<String> itemIds);
}
