package com.dqlproxy.exception;

/**
 * Grail base URL or API token is missing.
 */
public class BackendNotConfiguredException extends QueryProxyException {

    public BackendNotConfiguredException() {
        super(500, "BACKEND_NOT_CONFIGURED", "DT_URL/DT_TOKEN not configured");
    }
}
