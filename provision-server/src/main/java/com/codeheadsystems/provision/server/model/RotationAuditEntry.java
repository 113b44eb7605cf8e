package com.codeheadsystems.provision.server.model;

import java.time.Instant;

/**
 * Immutable record of one rotation attempt. Written on success and on failure.
 *
 * @param id         unique id
 * @param userId     owner
 * @param provider   provider name
 * @param oldVersion version before the attempt, null if the credential did not exist
 * @param newVersion version committed, null on failure
 * @param timestamp  when the attempt finished
 * @param success    whether the new version was committed
 * @param error      failure description, null on success
 */
public record RotationAuditEntry(String id,
                                 String userId,
                                 String provider,
                                 Integer oldVersion,
                                 Integer newVersion,
                                 Instant timestamp,
                                 boolean success,
                                 String error) {
}
