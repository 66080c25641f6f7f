package com.codeheadsystems.veil.client.model;

import java.net.URI;

/**
 * Base URI of the prover service. {@code prove} and {@code verify} are resolved against it.
 *
 * @param endpoint the endpoint
 */
public record ProverConnectionInfo(URI endpoint) {
}
