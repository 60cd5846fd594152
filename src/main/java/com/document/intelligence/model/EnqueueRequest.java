package com.document.intelligence.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hand-off from the file watcher: one absolute path, the calling application,
 * and whatever the watcher knows about the file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueRequest {

    private String path;
    private String applicationId;

    @Builder.Default
    private Metadata metadata = new Metadata();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private String originalFilename;
        private String sourceChannel;  // 'scanner', 'email', 'upload'
        private Instant timestamp;

        @Builder.Default
        private Map<String, String> attributes = new LinkedHashMap<>();
    }
}
