package com.codeheadsystems.provision.server.resource;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ResourceSupportTest {

  @Test
  void bearerToken_extractsToken() {
    assertThat(ResourceSupport.bearerToken("Bearer abc.def.ghi")).isEqualTo("abc.def.ghi");
    assertThat(ResourceSupport.bearerToken("bearer   abc ")).isEqualTo("abc");
  }

  @Test
  void bearerToken_missingOrOtherScheme_isNull() {
    assertThat(ResourceSupport.bearerToken(null)).isNull();
    assertThat(ResourceSupport.bearerToken("Bearer ")).isNull();
    assertThat(ResourceSupport.bearerToken("Basic dXNlcjpwYXNz")).isNull();
  }
}
