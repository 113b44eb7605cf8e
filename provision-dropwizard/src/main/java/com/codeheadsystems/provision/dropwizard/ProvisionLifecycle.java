package com.codeheadsystems.provision.dropwizard;

import com.codeheadsystems.provision.server.manager.KeyRotationManager;
import com.codeheadsystems.provision.server.manager.RotationScheduler;
import com.codeheadsystems.provision.server.ratelimit.BucketEvictor;
import io.dropwizard.lifecycle.Managed;

/**
 * Starts and stops the service's background work with the Dropwizard application.
 */
public class ProvisionLifecycle implements Managed {

  private final RotationScheduler rotationScheduler;
  private final KeyRotationManager rotationManager;
  private final BucketEvictor bucketEvictor;

  public ProvisionLifecycle(RotationScheduler rotationScheduler,
                            KeyRotationManager rotationManager,
                            BucketEvictor bucketEvictor) {
    this.rotationScheduler = rotationScheduler;
    this.rotationManager = rotationManager;
    this.bucketEvictor = bucketEvictor;
  }

  @Override
  public void start() {
    rotationScheduler.start();
    bucketEvictor.start();
  }

  @Override
  public void stop() {
    bucketEvictor.shutdown();
    rotationScheduler.shutdown();
    rotationManager.shutdown();
  }
}
