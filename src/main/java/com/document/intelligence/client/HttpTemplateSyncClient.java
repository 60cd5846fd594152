package com.document.intelligence.client;

import com.document.intelligence.exception.TemplateSyncException;
import com.document.intelligence.model.TemplateDefinition;
import com.document.intelligence.model.VariantProposal;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class HttpTemplateSyncClient implements TemplateSyncClient {

    private final RestClient restClient;

    public HttpTemplateSyncClient(@Qualifier("templateSyncRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<TemplateDefinition> fetchTemplates(String applicationId) {
        try {
            TemplateListResponse response = restClient.get()
                    .uri(uri -> uri.path("/api/ocr/templates")
                            .queryParam("calling_app_id", applicationId)
                            .build())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(TemplateListResponse.class);

            List<TemplateDefinition> templates = response != null && response.getTemplates() != null
                    ? response.getTemplates()
                    : List.of();
            log.info("Fetched {} templates for application {}", templates.size(), applicationId);
            return templates;
        } catch (RestClientException e) {
            throw new TemplateSyncException("Template pull failed for application " + applicationId
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void submitProposal(VariantProposal proposal) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("calling_app_id", proposal.getApplicationId());
        body.put("base_template_id", proposal.getBaseTemplateId());
        body.put("proposed_label", proposal.getProposedLabel());
        body.put("document_id", proposal.getDocumentId());
        body.put("similarity", proposal.getSimilarity());
        body.put("structural_signature", proposal.getObservedSignature());

        try {
            restClient.post()
                    .uri("/api/ocr/templates/proposals")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Submitted variant proposal {} for template {}", proposal.getId(), proposal.getBaseTemplateId());
        } catch (RestClientException e) {
            throw new TemplateSyncException("Proposal push failed for template " + proposal.getBaseTemplateId()
                    + ": " + e.getMessage(), e);
        }
    }

    @Data
    public static class TemplateListResponse {
        private List<TemplateDefinition> templates = new ArrayList<>();
    }
}
