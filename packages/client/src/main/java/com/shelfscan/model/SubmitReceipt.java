package com.shelfscan.model;

/**
 * Result of a successful submit: the server-assigned job id, the absolute stream URL and the
 * optional per-job credential needed for the stream and cleanup calls.
 */
public record SubmitReceipt(String jobId, String sseUrl, String authToken, String statusUrl) {}
