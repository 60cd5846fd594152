package com.document.intelligence.client;

import com.document.intelligence.exception.TemplateSyncException;
import com.document.intelligence.model.TemplateDefinition;
import com.document.intelligence.model.VariantProposal;

import java.util.List;

/**
 * The business system's template endpoints. It owns the authoritative
 * library; this pipeline only reads from it and proposes variants to it.
 */
public interface TemplateSyncClient {

    /**
     * @throws TemplateSyncException when the business system cannot be reached or answers with an error
     */
    List<TemplateDefinition> fetchTemplates(String applicationId);

    /**
     * @throws TemplateSyncException when the proposal could not be delivered
     */
    void submitProposal(VariantProposal proposal);
}
