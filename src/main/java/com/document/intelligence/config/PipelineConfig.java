package com.document.intelligence.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** One task per document, end to end. */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("documentWorkers")
    public ExecutorService documentWorkers(PipelineProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getLifecycle().getWorkerThreads()),
                namedThreads("doc-worker-"));
    }

    /** Runs the stages themselves, so a worker can stop waiting on one that overruns. */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("stageExecutor")
    public ExecutorService stageExecutor() {
        return Executors.newCachedThreadPool(namedThreads("doc-stage-"));
    }

    @Bean
    @Qualifier("templateSyncRestClient")
    public RestClient templateSyncRestClient(RestClient.Builder builder, PipelineProperties properties) {
        PipelineProperties.Templates templates = properties.getTemplates();
        return configure(builder.clone(), templates.getSyncBaseUrl(), templates.getApiKey(), templates.getSyncTimeout());
    }

    @Bean
    @Qualifier("downstreamRestClient")
    public RestClient downstreamRestClient(RestClient.Builder builder, PipelineProperties properties) {
        PipelineProperties.Downstream downstream = properties.getDownstream();
        return configure(builder.clone(), downstream.getBaseUrl(), downstream.getApiKey(),
                properties.getTemplates().getSyncTimeout());
    }

    private static RestClient configure(RestClient.Builder builder, String baseUrl, String apiKey, Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        builder.baseUrl(baseUrl).requestFactory(requestFactory);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder.build();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }
}
