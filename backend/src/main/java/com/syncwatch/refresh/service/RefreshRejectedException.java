package com.syncwatch.refresh.service;

import com.syncwatch.refresh.tracking.RefreshException;

/**
 * Provider refused to start a refresh. No job is created.
 */
public class RefreshRejectedException extends RefreshException {

    private final String code;

    public RefreshRejectedException(String code, String message) {
        super(null, message);
        this.code = code;
    }

    public RefreshRejectedException(String code, String message, Throwable cause) {
        super(null, message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
