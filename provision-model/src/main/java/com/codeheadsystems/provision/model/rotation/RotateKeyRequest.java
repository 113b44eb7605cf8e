package com.codeheadsystems.provision.model.rotation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param targetVersion optional target version; null means current version plus one
 */
public record RotateKeyRequest(@JsonProperty("targetVersion") Integer targetVersion) {
}
