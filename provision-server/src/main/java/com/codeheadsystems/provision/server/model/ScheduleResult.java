package com.codeheadsystems.provision.server.model;

public record ScheduleResult(String id, boolean created, boolean updated) {
}
