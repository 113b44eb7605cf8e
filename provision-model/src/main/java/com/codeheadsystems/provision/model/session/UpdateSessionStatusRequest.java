package com.codeheadsystems.provision.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param status target status name: active, idle, stopped or error
 */
public record UpdateSessionStatusRequest(@JsonProperty("status") String status) {
}
