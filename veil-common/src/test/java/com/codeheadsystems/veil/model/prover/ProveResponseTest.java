package com.codeheadsystems.veil.model.prover;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProveResponseTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void json_deserialization_mapsToCorrectFields() throws Exception {
    String json = "{\"requestId\":\"r\",\"proof\":\"AQID\",\"publicSignals\":[\"1\",\"2\"]}";

    ProveResponse response = objectMapper.readValue(json, ProveResponse.class);

    assertThat(response.requestId()).isEqualTo("r");
    assertThat(response.proofBase64()).isEqualTo("AQID");
    assertThat(response.publicSignals()).containsExactly("1", "2");
  }

  @Test
  void verifyModels_roundTrip() throws Exception {
    VerifyRequest request = new VerifyRequest("vk", "AQID", List.of("1"));
    assertThat(objectMapper.readValue(objectMapper.writeValueAsString(request), VerifyRequest.class))
        .isEqualTo(request);
    assertThat(objectMapper.readValue("{\"valid\":true}", VerifyResponse.class).valid()).isTrue();
  }
}
