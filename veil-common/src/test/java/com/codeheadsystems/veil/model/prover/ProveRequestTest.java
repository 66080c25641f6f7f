package com.codeheadsystems.veil.model.prover;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProveRequestTest {

  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper();
  }

  @Test
  void json_serialization_usesWireNames() throws Exception {
    ProveRequest request = new ProveRequest("req-1", "withdraw-v1", "withdraw-v1.zkey",
        Map.of("root", List.of("42")));

    String json = objectMapper.writeValueAsString(request);

    assertThat(json).contains("\"requestId\":\"req-1\"");
    assertThat(json).contains("\"circuit\":\"withdraw-v1\"");
    assertThat(json).contains("\"provingKey\":\"withdraw-v1.zkey\"");
    assertThat(json).contains("\"inputs\":{\"root\":[\"42\"]}");
  }

  @Test
  void json_roundTrip_preservesAllFields() throws Exception {
    ProveRequest original = new ProveRequest("req-2", "c", "k",
        Map.of("pathElements", List.of("1", "2", "3"), "fee", List.of("0")));

    ProveRequest restored = objectMapper.readValue(objectMapper.writeValueAsString(original), ProveRequest.class);

    assertThat(restored).isEqualTo(original);
  }
}
