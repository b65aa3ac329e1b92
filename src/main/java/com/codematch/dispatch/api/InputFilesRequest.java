package com.codematch.dispatch.api;

import java.util.Map;

/**
 * Inbound JSON body for file uploads.
 *
 * @param files file contents keyed by path
 */
public record InputFilesRequest(
    Map<String, String> files
) {}
