package com.document.intelligence.client;

import com.document.intelligence.model.FinalizePayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@Slf4j
public class HttpBusinessSystemClient implements BusinessSystemClient {

    private final RestClient restClient;

    public HttpBusinessSystemClient(@Qualifier("downstreamRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * @throws org.springframework.web.client.RestClientException when the business system rejects or cannot take the document
     */
    @Override
    public void finalizeDocument(FinalizePayload payload) {
        restClient.post()
                .uri("/api/ocr/documents/finalize")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .toBodilessEntity();
        log.info("Finalized document {} with template {} (confidence {})",
                payload.getDocumentId(), payload.getTemplateId(), payload.getOverallConfidence());
    }
}
