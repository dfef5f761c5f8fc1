package com.apitools.service.impl;

import com.apitools.model.CassetteMode;
import com.apitools.model.ProxyRequest;
import com.apitools.model.ProxyResponse;
import com.apitools.model.ServerDefinition;
import com.apitools.model.ToolResult;
import com.apitools.service.api.CassetteRecorder;
import com.apitools.service.api.HttpProxy;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.Exceptions;

/**
 * Sends prepared requests upstream through {@link WebClient}, or answers them from cassettes.
 * Transport failures, timeouts and cassette errors all end up as a failed {@link ToolResult}.
 */
@Service
@Slf4j
public class HttpProxyImpl implements HttpProxy {

    private final WebClient webClient;
    private final CassetteRecorder cassetteRecorder;
    private final Duration defaultTimeout;

    public HttpProxyImpl(WebClient webClient, CassetteRecorder cassetteRecorder,
                         @Value("${apitools.http.default-timeout-seconds:30}") double defaultTimeoutSeconds) {
        this.webClient = webClient;
        this.cassetteRecorder = cassetteRecorder;
        this.defaultTimeout = seconds(defaultTimeoutSeconds);
    }

    @Override
    public ToolResult execute(ServerDefinition server, ProxyRequest request, Map<String, String> incomingHeaders) {
        ProxyRequest outgoing = prepare(server, request, incomingHeaders);

        if (server.cassettes() == CassetteMode.REPLAY) {
            return replay(server, outgoing);
        }

        Duration timeout = server.timeout() != null ? seconds(server.timeout()) : defaultTimeout;
        log.info("Making {} request to {}", outgoing.method(), outgoing.url());
        log.debug("Query: {} Body: {}", outgoing.queryParams(),
                outgoing.formData() != null ? outgoing.formData() : outgoing.jsonBody());

        ProxyResponse response;
        try {
            response = send(outgoing, timeout);
        } catch (WebClientRequestException e) {
            log.warn("Request to {} failed: {}", outgoing.url(), e.getMessage());
            return ToolResult.failure("Request to " + outgoing.url() + " failed: " + e.getMessage());
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                log.warn("Request to {} timed out after {}", outgoing.url(), timeout);
                return ToolResult.failure("Request to " + outgoing.url() + " timed out after "
                        + timeout.toMillis() + " ms");
            }
            log.error("Unexpected failure calling {}", outgoing.url(), e);
            return ToolResult.failure("Request to " + outgoing.url() + " failed: " + e.getMessage());
        }

        if (!response.isSuccessful()) {
            log.warn("{} {} answered with status {}", outgoing.method(), outgoing.url(), response.statusCode());
        }
        if (server.cassettes() == CassetteMode.RECORD) {
            try {
                cassetteRecorder.record(server.namespace(), outgoing, response);
            } catch (RuntimeException e) {
                log.warn("Could not record {} {} for {}: {}", outgoing.method(), outgoing.url(), server.namespace(),
                        e.getMessage());
            }
        }
        return ToolResult.of(response);
    }

    private ToolResult replay(ServerDefinition server, ProxyRequest request) {
        try {
            return cassetteRecorder.replay(server.namespace(), request)
                    .map(ToolResult::of)
                    .orElseGet(() -> ToolResult.failure("No recorded response for "
                            + request.method() + " " + request.url()));
        } catch (RuntimeException e) {
            log.warn("Could not replay {} {} for {}", request.method(), request.url(), server.namespace(), e);
            return ToolResult.failure("Could not replay " + request.method() + " " + request.url() + ": "
                    + e.getMessage());
        }
    }

    /**
     * Applies the server's header forwarding rules and removes {@code null} values.
     */
    ProxyRequest prepare(ServerDefinition server, ProxyRequest request, Map<String, String> incomingHeaders) {
        Map<String, String> incoming = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (incomingHeaders != null) {
            incoming.putAll(incomingHeaders);
        }

        Map<String, String> headers = new LinkedHashMap<>(request.headers());
        for (String name : server.headers()) {
            String value = incoming.get(name);
            if (value != null) {
                headers.put(name, value);
            }
        }

        Map<String, Object> query = withoutNulls(request.queryParams());
        server.forwardQueryParams().forEach((header, parameter) -> {
            String value = incoming.get(header);
            if (value != null) {
                query.put(parameter, value);
            }
        });

        Object json = request.jsonBody() instanceof Map<?, ?> map ? withoutNulls(castToStringKeys(map)) : request.jsonBody();
        Map<String, Object> form = request.formData() == null ? null : withoutNulls(request.formData());
        return new ProxyRequest(request.method(), request.url(), query, headers, json, form);
    }

    private ProxyResponse send(ProxyRequest request, Duration timeout) {
        WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.method())).uri(toUri(request));
        request.headers().forEach((name, value) -> spec.header(name, value));

        WebClient.RequestHeadersSpec<?> ready = spec;
        if (request.formData() != null && !request.formData().isEmpty()) {
            ready = spec.contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(toMultiValueMap(request.formData())));
        } else if (request.jsonBody() != null) {
            ready = spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.jsonBody());
        }

        return ready.exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ProxyResponse(response.statusCode().value(),
                                response.headers().asHttpHeaders().toSingleValueMap(), body)))
                .timeout(timeout)
                .block();
    }

    private static URI toUri(ProxyRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(request.url());
        request.queryParams().forEach((name, value) -> {
            String encodedName = UriUtils.encodeQueryParam(name, StandardCharsets.UTF_8);
            if (value instanceof Collection<?> values) {
                values.forEach(item -> builder.queryParam(encodedName, encode(item)));
            } else if (value instanceof Map<?, ?> nested) {
                nested.forEach((key, item) -> builder.queryParam(
                        UriUtils.encodeQueryParam(name + "[" + key + "]", StandardCharsets.UTF_8), encode(item)));
            } else {
                builder.queryParam(encodedName, encode(value));
            }
        });
        return builder.build(true).toUri();
    }

    /**
     * Encodes a query value, escaping a literal {@code +} as well.
     */
    private static String encode(Object value) {
        return UriUtils.encodeQueryParam(String.valueOf(value), StandardCharsets.UTF_8).replace("+", "%2B");
    }

    private static MultiValueMap<String, String> toMultiValueMap(Map<String, Object> form) {
        MultiValueMap<String, String> values = new LinkedMultiValueMap<>();
        form.forEach((name, value) -> {
            if (value instanceof Collection<?> items) {
                items.forEach(item -> values.add(name, String.valueOf(item)));
            } else {
                values.add(name, String.valueOf(value));
            }
        });
        return values;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> values) {
        Map<String, Object> result = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (value != null) {
                result.put(name, value);
            }
        });
        return result;
    }

    private static Map<String, Object> castToStringKeys(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private static Duration seconds(double seconds) {
        return Duration.ofMillis(Math.round(seconds * 1000));
    }
}
