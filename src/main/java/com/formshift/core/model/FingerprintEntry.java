package com.formshift.core.model;

import java.time.Instant;

/**
 * Cached content fingerprint of one source file.
 *
 * @param fingerprint   hex-encoded content digest
 * @param lastModified  source file modification time when fingerprinted
 * @param lastConverted when the file was last converted successfully
 */
public record FingerprintEntry(
    String fingerprint,
    Instant lastModified,
    Instant lastConverted
) {}
