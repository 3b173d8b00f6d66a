package com.openrangelabs.donpetre.credentials.validation.probe;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Transport used for live key validation: a single GET with the given headers.
 *
 * <p>Implementations signal transport failures and timeouts as errors; a non-2xx
 * status is a normal {@link ProbeResponse}.
 */
public interface ProbeClient {

    Mono<ProbeResponse> get(String url, Map<String, String> headers, Duration timeout);
}
