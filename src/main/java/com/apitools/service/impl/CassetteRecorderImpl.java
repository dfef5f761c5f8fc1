package com.apitools.service.impl;

import com.apitools.exception.ApiToolsException;
import com.apitools.model.Cassette;
import com.apitools.model.ProxyRequest;
import com.apitools.model.ProxyResponse;
import com.apitools.service.api.CassetteRecorder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Stores upstream exchanges as JSON files under {@code <directory>/<namespace>/}.
 * <p>
 * Files are named {@code <yyyyMMdd_HHmmss_SSS>_<method>_<last path segment>.json}, so the
 * lexicographic order of names is the chronological order. Values of sensitive request headers
 * are encrypted with the Jasypt {@link StringEncryptor} and stored as {@code ENC(...)}.
 */
@Service
@Slf4j
public class CassetteRecorderImpl implements CassetteRecorder {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final String ENCRYPTED_PREFIX = "ENC(";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Path directory;
    private final Set<String> sensitiveHeaders;
    private final StringEncryptor encryptor;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public CassetteRecorderImpl(@Value("${apitools.cassettes.directory:cassettes}") String directory,
                                @Value("${apitools.cassettes.sensitive-headers:authorization,proxy-authorization,cookie,x-api-key}")
                                List<String> sensitiveHeaders,
                                StringEncryptor encryptor) {
        this.directory = Path.of(directory);
        this.sensitiveHeaders = sensitiveHeaders.stream()
                .map(header -> header.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        this.encryptor = encryptor;
    }

    @Override
    public synchronized void record(String namespace, ProxyRequest request, ProxyResponse response) {
        LocalDateTime now = LocalDateTime.now();
        Cassette cassette = new Cassette(
                new Cassette.Request(request.method(), request.url(), request.queryParams(), request.jsonBody(),
                        request.formData(), protect(request.headers())),
                new Cassette.Response(response.statusCode(), response.headers(), response.body()),
                now.toString());
        Path folder = directory.resolve(namespace);
        Path file = folder.resolve(FILE_STAMP.format(now) + "_" + request.method().toLowerCase(Locale.ROOT) + "_"
                + lastSegment(request.url()) + ".json");
        try {
            Files.createDirectories(folder);
            objectMapper.writeValue(file.toFile(), cassette);
            log.info("Recorded cassette {}", file);
        } catch (IOException e) {
            throw new ApiToolsException("Failed to write cassette " + file, e);
        }
    }

    @Override
    public Optional<ProxyResponse> replay(String namespace, ProxyRequest request) {
        Map<String, Object> wanted = comparable(request);
        for (Cassette cassette : list(namespace)) {
            Cassette.Request recorded = cassette.request();
            if (Objects.equals(wanted, comparable(new ProxyRequest(recorded.method(), recorded.url(),
                    recorded.params(), recorded.headers(), recorded.json(), recorded.form())))) {
                log.info("Replaying recorded {} {}", recorded.method(), recorded.url());
                Cassette.Response response = cassette.response();
                return Optional.of(new ProxyResponse(response.statusCode(), response.headers(), response.text()));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Cassette> list(String namespace) {
        Path folder = directory.resolve(namespace);
        if (!Files.isDirectory(folder)) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(folder)) {
            files = stream.filter(file -> file.getFileName().toString().endsWith(".json"))
                    .sorted(Comparator.comparing((Path file) -> file.getFileName().toString()).reversed())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ApiToolsException("Failed to list cassettes in " + folder, e);
        }
        List<Cassette> cassettes = new ArrayList<>();
        for (Path file : files) {
            try {
                Cassette cassette = objectMapper.readValue(file.toFile(), Cassette.class);
                cassettes.add(reveal(cassette));
            } catch (IOException e) {
                log.warn("Skipping unreadable cassette {}: {}", file, e.getMessage());
            }
        }
        return cassettes;
    }

    private Map<String, String> protect(Map<String, String> headers) {
        Map<String, String> result = new LinkedHashMap<>();
        headers.forEach((name, value) -> result.put(name, isSensitive(name)
                ? ENCRYPTED_PREFIX + encryptor.encrypt(value) + ")"
                : value));
        return result;
    }

    private Cassette reveal(Cassette cassette) {
        Cassette.Request request = cassette.request();
        if (request == null || request.headers() == null) {
            return cassette;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        request.headers().forEach((name, value) -> headers.put(name, isEncrypted(value)
                ? encryptor.decrypt(value.substring(ENCRYPTED_PREFIX.length(), value.length() - 1))
                : value));
        return new Cassette(new Cassette.Request(request.method(), request.url(), request.params(), request.json(),
                request.form(), headers), cassette.response(), cassette.timestamp());
    }

    private boolean isSensitive(String header) {
        return sensitiveHeaders.contains(header.toLowerCase(Locale.ROOT));
    }

    private static boolean isEncrypted(String value) {
        return value != null && value.startsWith(ENCRYPTED_PREFIX) && value.endsWith(")");
    }

    /**
     * The parts of a request a replay must match, normalized through JSON so that recorded and
     * live values compare equal regardless of their Java types.
     */
    private Map<String, Object> comparable(ProxyRequest request) {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("method", request.method());
        key.put("url", request.url());
        key.put("params", request.queryParams());
        key.put("json", request.jsonBody());
        key.put("form", request.formData());
        return objectMapper.convertValue(key, MAP_TYPE);
    }

    static String lastSegment(String url) {
        String path = url.replaceAll("[?#].*$", "");
        List<String> segments = Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).collect(Collectors.toList());
        String last = segments.isEmpty() ? "root" : segments.get(segments.size() - 1);
        return last.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
