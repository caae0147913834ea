package com.metricsentinel.core.http;

import java.io.IOException;

/**
 * A collaborator answered with a non-2xx status.
 *
 * @since 1.0.0
 */
public class HttpStatusException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public HttpStatusException(String method, String url, int statusCode, String message) {
        super(method + " " + url + " returned HTTP " + statusCode
                + (message == null || message.isBlank() ? "" : " (" + message + ")"));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
