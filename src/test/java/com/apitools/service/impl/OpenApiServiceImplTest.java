package com.apitools.service.impl;

import com.apitools.exception.ApiToolsException;
import com.apitools.exception.SpecLoadException;
import com.apitools.model.ApiOperation;
import com.apitools.model.ApiPath;
import com.apitools.model.ApiSpecification;
import com.apitools.model.SpecSource;
import com.apitools.service.api.CacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenApiServiceImplTest {

    @Mock
    private CacheStore cacheStore;

    private OpenApiServiceImpl openApiService;

    @BeforeEach
    void setUp() {
        openApiService = new OpenApiServiceImpl(new OperationExtractorImpl(new SchemaResolver(), 10), cacheStore);
    }

    @Test
    void loadAndParseSpec_shouldParseLocalFileAndStoreInCache() {
        SpecSource source = SpecSource.file(OpenApiFixtures.path("openapi/users.yaml"));
        String key = OpenApiServiceImpl.cacheKey(source.location(), List.of("/api/v1/users"));
        when(cacheStore.get(key)).thenReturn(Optional.empty());

        ApiSpecification specification = openApiService.loadAndParseSpec(source, List.of("/api/v1/users"), true);

        assertThat(specification.serverUrls()).containsExactly("https://api.example.com");
        assertThat(specification.paths()).extracting(ApiPath::path).containsExactly(
                "/api/v1/users", "/api/v1/users/{userId}", "/api/v1/users/{userId}/avatar");
        assertThat(specification.operationCount()).isEqualTo(5);
        verify(cacheStore).put(eq(key), any());
    }

    @Test
    void loadAndParseSpec_shouldReturnCachedSpecificationWithoutReadingSource() throws Exception {
        ApiOperation health = new ApiOperation("health", "Health", null, List.of(), null, Map.of());
        ApiSpecification cached = new ApiSpecification(
                List.of(new ApiPath("/health", health, null, null, null, null)), List.of("https://cached.example"));
        SpecSource source = SpecSource.file("/does/not/exist.yaml");
        when(cacheStore.get(OpenApiServiceImpl.cacheKey(source.location(), List.of("/health"))))
                .thenReturn(Optional.of(new ObjectMapper().writeValueAsBytes(cached)));

        ApiSpecification specification = openApiService.loadAndParseSpec(source, List.of("/health"), true);

        assertThat(specification).isEqualTo(cached);
        verify(cacheStore, never()).put(anyString(), any());
    }

    @Test
    void loadAndParseSpec_shouldRoundTripThroughCache() {
        SpecSource source = SpecSource.file(OpenApiFixtures.path("openapi/composition.yaml"));
        when(cacheStore.get(anyString())).thenReturn(Optional.empty());
        ApiSpecification parsed = openApiService.loadAndParseSpec(source, List.of("/"), true);
        ArgumentCaptor<byte[]> written = ArgumentCaptor.forClass(byte[].class);
        verify(cacheStore).put(anyString(), written.capture());

        when(cacheStore.get(anyString())).thenReturn(Optional.of(written.getValue()));
        ApiSpecification reloaded = openApiService.loadAndParseSpec(source, List.of("/"), true);

        assertThat(reloaded).isEqualTo(parsed);
    }

    @Test
    void loadAndParseSpec_shouldBypassCacheWhenDisabled() {
        SpecSource source = SpecSource.file(OpenApiFixtures.path("openapi/weather.yaml"));

        ApiSpecification specification = openApiService.loadAndParseSpec(source, List.of("/v1"), false);

        assertThat(specification.paths()).hasSize(1);
        verifyNoInteractions(cacheStore);
    }

    @Test
    void loadAndParseSpec_shouldTreatUnreadableCacheEntryAsMiss() {
        SpecSource source = SpecSource.file(OpenApiFixtures.path("openapi/weather.yaml"));
        when(cacheStore.get(anyString())).thenReturn(Optional.of("not json".getBytes(StandardCharsets.UTF_8)));

        ApiSpecification specification = openApiService.loadAndParseSpec(source, List.of("/v1"), true);

        assertThat(specification.paths()).extracting(ApiPath::path).containsExactly("/v1/forecast");
        verify(cacheStore).put(anyString(), any());
    }

    @Test
    void loadAndParseSpec_shouldReturnResultWhenCacheWriteFails() {
        SpecSource source = SpecSource.file(OpenApiFixtures.path("openapi/weather.yaml"));
        when(cacheStore.get(anyString())).thenReturn(Optional.empty());
        doThrow(new ApiToolsException("disk full")).when(cacheStore).put(anyString(), any());

        ApiSpecification specification = openApiService.loadAndParseSpec(source, List.of("/v1"), true);

        assertThat(specification.operationCount()).isEqualTo(1);
    }

    @Test
    void loadAndParseSpec_shouldThrowForMissingDocument() {
        SpecSource source = SpecSource.file("/definitely/not/here/openapi.yaml");

        assertThatThrownBy(() -> openApiService.loadAndParseSpec(source, List.of("/"), false))
                .isInstanceOf(SpecLoadException.class)
                .hasMessageContaining("/definitely/not/here/openapi.yaml");
    }

    @Test
    void cacheKey_shouldIgnorePatternOrderButNotSource() {
        String key = OpenApiServiceImpl.cacheKey("a.yaml", List.of("/users", "/pets"));

        assertThat(key).isEqualTo(OpenApiServiceImpl.cacheKey("a.yaml", List.of("/pets", "/users")));
        assertThat(key).isNotEqualTo(OpenApiServiceImpl.cacheKey("b.yaml", List.of("/pets", "/users")));
        assertThat(key).hasSize(32);
    }
}
