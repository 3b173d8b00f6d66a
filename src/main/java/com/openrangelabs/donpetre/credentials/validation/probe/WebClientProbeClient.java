package com.openrangelabs.donpetre.credentials.validation.probe;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * {@link ProbeClient} over Spring's reactive {@link WebClient}. The response body is
 * discarded; only status and a few headers are kept.
 */
@Slf4j
public class WebClientProbeClient implements ProbeClient {

    private final WebClient webClient;

    public WebClientProbeClient(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<ProbeResponse> get(String url, Map<String, String> headers, Duration timeout) {
        return webClient.get()
                .uri(url)
                .headers(httpHeaders -> headers.forEach(httpHeaders::set))
                .exchangeToMono(response -> response.releaseBody().thenReturn(toProbeResponse(response)))
                .timeout(timeout)
                .doOnError(error -> log.debug("Probe of {} failed: {}", url, error.toString()));
    }

    private ProbeResponse toProbeResponse(ClientResponse response) {
        int status = response.statusCode().value();
        HttpStatus resolved = HttpStatus.resolve(status);
        HttpHeaders headers = response.headers().asHttpHeaders();
        return ProbeResponse.builder()
                .status(status)
                .statusText(resolved != null ? resolved.getReasonPhrase() : "")
                .contentType(headers.getFirst(HttpHeaders.CONTENT_TYPE))
                .server(headers.getFirst(HttpHeaders.SERVER))
                .build();
    }
}
