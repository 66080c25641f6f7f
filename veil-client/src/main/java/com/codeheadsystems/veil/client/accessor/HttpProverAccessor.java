package com.codeheadsystems.veil.client.accessor;

import com.codeheadsystems.veil.circuit.CircuitInputs;
import com.codeheadsystems.veil.circuit.PublicSignals;
import com.codeheadsystems.veil.circuit.WithdrawalProof;
import com.codeheadsystems.veil.client.config.CircuitArtifacts;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.client.exceptions.ProverAccessorException;
import com.codeheadsystems.veil.client.model.ProofStage;
import com.codeheadsystems.veil.client.model.ProverConnectionInfo;
import com.codeheadsystems.veil.exceptions.ProofGenerationException;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.prover.ProveRequest;
import com.codeheadsystems.veil.model.prover.ProveResponse;
import com.codeheadsystems.veil.model.prover.VerifyRequest;
import com.codeheadsystems.veil.model.prover.VerifyResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProverAccessor} backed by a remote prover service speaking JSON over HTTP.
 * <p>
 * The service runs witness generation and proving in one call, so both stages are reported
 * before the request goes out.
 */
@Singleton
public class HttpProverAccessor implements ProverAccessor {
  private static final Logger log = LoggerFactory.getLogger(HttpProverAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ProverConnectionInfo connectionInfo;

  /**
   * Instantiates a new Http prover accessor.
   *
   * @param veilClientConfig the veil client config
   * @param httpClient       the http client
   * @param objectMapper     the object mapper
   * @param connectionInfo   the connection info
   */
  @Inject
  public HttpProverAccessor(final VeilClientConfig veilClientConfig,
                            final HttpClient httpClient,
                            final ObjectMapper objectMapper,
                            final ProverConnectionInfo connectionInfo) {
    log.info("HttpProverAccessor({}, {})", veilClientConfig.circuitArtifacts(), connectionInfo);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
  }

  @Override
  public WithdrawalProof prove(final CircuitInputs inputs,
                               final CircuitArtifacts artifacts,
                               final Consumer<ProofStage> stageListener) {
    final String requestId = UUID.randomUUID().toString();
    log.trace("prove(requestId={}, circuit={})", requestId, artifacts.circuitId());
    stageListener.accept(ProofStage.WITNESS);
    final ProveRequest request = new ProveRequest(requestId, artifacts.circuitId(), artifacts.provingKeyId(),
        toNamedInputs(inputs));
    stageListener.accept(ProofStage.PROVING);
    final ProveResponse response = post("prove", request, ProveResponse.class);
    if (!requestId.equals(response.requestId())) {
      throw new ProofGenerationException("Prover answered a different request: " + response.requestId(), null);
    }
    try {
      return new WithdrawalProof(Base64.getDecoder().decode(response.proofBase64()),
          PublicSignals.fromSignalStrings(response.publicSignals()));
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new ProofGenerationException("Malformed prover response for request " + requestId, e);
    }
  }

  @Override
  public boolean verify(final WithdrawalProof proof, final CircuitArtifacts artifacts) {
    log.trace("verify(verificationKey={})", artifacts.verificationKeyId());
    final VerifyRequest request = new VerifyRequest(artifacts.verificationKeyId(),
        Base64.getEncoder().encodeToString(proof.proof()), proof.signals().toSignalStrings());
    return post("verify", request, VerifyResponse.class).valid();
  }

  /**
   * Circuit signal names mapped to decimal values.
   *
   * @param inputs the inputs
   * @return the map
   */
  static Map<String, List<String>> toNamedInputs(final CircuitInputs inputs) {
    final Map<String, List<String>> named = new LinkedHashMap<>();
    named.put("nullifier", List.of(decimal(inputs.nullifierPreimage())));
    named.put("secret", List.of(decimal(inputs.secret())));
    final List<String> pathElements = new ArrayList<>();
    inputs.siblings().forEach(sibling -> pathElements.add(decimal(sibling)));
    named.put("pathElements", pathElements);
    final List<String> pathIndices = new ArrayList<>();
    for (int bit : inputs.pathBits()) {
      pathIndices.add(Integer.toString(bit));
    }
    named.put("pathIndices", pathIndices);
    named.put("root", List.of(decimal(inputs.root())));
    named.put("nullifierHash", List.of(decimal(inputs.nullifierHash())));
    named.put("recipient", List.of(decimal(inputs.recipient().bytes())));
    named.put("relayer", List.of(decimal(inputs.relayer().bytes())));
    named.put("fee", List.of(Long.toString(inputs.fee())));
    final Address bound = inputs.commitmentRecipient() == null ? Address.ZERO : inputs.commitmentRecipient();
    named.put("commitmentRecipient", List.of(decimal(bound.bytes())));
    return named;
  }

  private static String decimal(final byte[] value) {
    return new BigInteger(1, value).toString();
  }

  private <T> T post(final String path, final Object body, final Class<T> responseType) {
    final URI uri = connectionInfo.endpoint().resolve(path);
    try {
      final String requestBody = objectMapper.writeValueAsString(body);
      final HttpRequest httpRequest = HttpRequest.newBuilder()
          .uri(uri)
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();

      final HttpResponse<String> httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      checkStatus(uri, httpResponse.statusCode());
      return objectMapper.readValue(httpResponse.body(), responseType);
    } catch (IOException e) {
      throw new ProverAccessorException("HTTP request failed for prover: " + uri, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProverAccessorException("HTTP request interrupted for prover: " + uri, e);
    }
  }

  private void checkStatus(final URI uri, final int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("Prover rejected request (401): " + uri);
    }
    if (statusCode == 422) {
      throw new ProofGenerationException("Prover could not satisfy the circuit (422): " + uri, null);
    }
    if (statusCode >= 400) {
      throw new ProverAccessorException("Prover returned HTTP " + statusCode + ": " + uri, null);
    }
  }
}
