package com.codeheadsystems.provision.dropwizard;

import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal Dropwizard application used only in integration tests.
 */
public class ProvisionApplication extends Application<ProvisionConfiguration> {

  public static void main(String[] args) throws Exception {
    new ProvisionApplication().run(args);
  }

  @Override
  public String getName() {
    return "provision-test";
  }

  @Override
  public void initialize(Bootstrap<ProvisionConfiguration> bootstrap) {
    bootstrap.addBundle(new ProvisionBundle<>());
  }

  @Override
  public void run(ProvisionConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle
  }
}
