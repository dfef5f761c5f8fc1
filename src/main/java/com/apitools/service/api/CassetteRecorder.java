package com.apitools.service.api;

import com.apitools.model.Cassette;
import com.apitools.model.ProxyRequest;
import com.apitools.model.ProxyResponse;
import java.util.List;
import java.util.Optional;

/**
 * Records upstream exchanges to disk and answers requests from earlier recordings.
 */
public interface CassetteRecorder {

    void record(String namespace, ProxyRequest request, ProxyResponse response);

    /**
     * Finds the most recent recording whose method, URL, query parameters and body equal the request.
     */
    Optional<ProxyResponse> replay(String namespace, ProxyRequest request);

    /**
     * @return All recordings of the namespace, newest first, with header values decrypted.
     */
    List<Cassette> list(String namespace);
}
