package com.codeheadsystems.provision.server.model;

public enum ScheduleStatus {
  PENDING,
  COMPLETED,
  FAILED
}
