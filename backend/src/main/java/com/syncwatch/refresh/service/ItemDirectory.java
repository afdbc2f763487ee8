package com.syncwatch.refresh.service;

import java.util.List;

/**
 * Lists every linked item known to the provider. Used when a refresh names no items.
 */
public interface ItemDirectory {

    List<String> listItemIds();
}
