package com.document.intelligence.client;

import com.document.intelligence.model.FinalizePayload;

/**
 * Hands an auto-committed document to the business system.
 */
public interface BusinessSystemClient {

    void finalizeDocument(FinalizePayload payload);
}
