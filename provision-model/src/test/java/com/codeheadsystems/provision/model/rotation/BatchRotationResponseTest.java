package com.codeheadsystems.provision.model.rotation;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchRotationResponseTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void serializesPerItemResults() throws Exception {
    BatchRotationResponse response = new BatchRotationResponse(2, 1, 1, false, List.of(
        new RotationResultView("openai", true, 1, 2, null, null),
        new RotationResultView("anthropic", false, 1, null, "INTEGRITY_FAILURE", "Stored credential failed integrity check")));

    JsonNode json = mapper.readTree(mapper.writeValueAsString(response));

    assertThat(json.get("totalKeys").asInt()).isEqualTo(2);
    assertThat(json.get("results")).hasSize(2);
    assertThat(json.get("results").get(1).get("errorCode").asText()).isEqualTo("INTEGRITY_FAILURE");
    assertThat(json.get("results").get(1).get("newVersion").isNull()).isTrue();
  }

  @Test
  void rotateAllRequest_readsMode() throws Exception {
    RotateAllRequest request = mapper.readValue("{\"mode\":\"all_or_nothing\"}", RotateAllRequest.class);
    assertThat(request.mode()).isEqualTo("all_or_nothing");
    assertThat(request.providers()).isNull();
  }
}
