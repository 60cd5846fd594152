package com.document.intelligence.service;

import com.document.intelligence.client.TemplateSyncClient;
import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.entity.DocumentTemplate;
import com.document.intelligence.entity.VariantProposalRecord;
import com.document.intelligence.exception.TemplateSyncException;
import com.document.intelligence.model.StructuralSignature;
import com.document.intelligence.model.Template;
import com.document.intelligence.model.TemplateDefinition;
import com.document.intelligence.model.VariantProposal;
import com.document.intelligence.repository.DocumentTemplateRepository;
import com.document.intelligence.repository.VariantProposalRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-through cache of the business system's templates, one snapshot per
 * calling application.
 *
 * <p>Staleness policy: a snapshot is served until it is {@code cache-ttl} old,
 * then the next reader pulls a fresh copy. When the pull fails the old
 * snapshot keeps being served (or, before any snapshot exists, the local
 * mirror table) and the pull is retried after {@link #RETRY_AFTER_FAILURE}.
 * Only one pull per application runs at a time; readers that cannot get the
 * refresh lock within {@code refresh-lock-timeout} are served whatever is
 * cached.
 */
@Service
@Slf4j
public class TemplateLibrary {

    static final Duration RETRY_AFTER_FAILURE = Duration.ofMinutes(1);

    private final TemplateSyncClient syncClient;
    private final DocumentTemplateRepository templateRepo;
    private final VariantProposalRepository proposalRepo;
    private final PipelineProperties.Templates config;
    private final Clock clock;

    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    public TemplateLibrary(TemplateSyncClient syncClient,
                           DocumentTemplateRepository templateRepo,
                           VariantProposalRepository proposalRepo,
                           PipelineProperties properties,
                           Clock clock) {
        this.syncClient = syncClient;
        this.templateRepo = templateRepo;
        this.proposalRepo = proposalRepo;
        this.config = properties.getTemplates();
        this.clock = clock;
    }

    /**
     * Templates of the application that can take part in matching, i.e. that
     * have a reference signature.
     */
    public List<Template> candidates(String applicationId) {
        return templates(applicationId).stream()
                .filter(Template::hasSignature)
                .toList();
    }

    public List<Template> templates(String applicationId) {
        Snapshot snapshot = snapshots.get(applicationId);
        if (snapshot != null && snapshot.isFresh(clock.instant())) {
            return snapshot.templates;
        }
        return load(applicationId, false);
    }

    public Optional<Template> find(String applicationId, String templateId) {
        Optional<Template> cached = templates(applicationId).stream()
                .filter(t -> t.getTemplateId().equals(templateId))
                .findFirst();
        if (cached.isPresent()) return cached;
        return templateRepo.findByApplicationIdAndTemplateId(applicationId, templateId)
                .map(DocumentTemplate::toModel);
    }

    /**
     * Pulls now, regardless of the snapshot's age.
     */
    public List<Template> refresh(String applicationId) {
        return load(applicationId, true);
    }

    /**
     * Applies a template pushed by the business system: mirrored locally and
     * visible to the next match without waiting for the TTL.
     */
    public Template upsert(String applicationId, TemplateDefinition definition) {
        DocumentTemplate saved = templateRepo.save(toEntity(applicationId, definition,
                templateRepo.findByApplicationIdAndTemplateId(applicationId, definition.getTemplateId())
                        .orElse(null)));
        Template template = saved.toModel();

        snapshots.computeIfPresent(applicationId, (key, current) -> {
            List<Template> updated = new ArrayList<>();
            boolean replaced = false;
            for (Template t : current.templates) {
                if (t.getTemplateId().equals(template.getTemplateId())) {
                    updated.add(template);
                    replaced = true;
                } else {
                    updated.add(t);
                }
            }
            if (!replaced) updated.add(template);
            return new Snapshot(List.copyOf(updated), current.expiresAt);
        });

        log.info("Upserted template {} v{} for application {}",
                template.getTemplateId(), template.getVersion(), applicationId);
        return template;
    }

    /**
     * Records a suspected format drift of {@code base} and asks the business
     * system to review it. The library itself never changes because of a
     * proposal; a new template only arrives through a later pull or push.
     */
    /**
     * Records a variant proposal for the document and hands it to the business
     * system. A document resumed after a crash proposes at most once per base
     * template: the stored proposal is returned, and redelivered if still pending.
     */
    public VariantProposal proposeVariant(Template base, StructuralSignature observed, double similarity,
                                          String documentId) {
        Optional<VariantProposalRecord> existing = documentId == null ? Optional.empty()
                : proposalRepo.findFirstByDocumentIdAndBaseTemplateIdOrderByCreatedAtDesc(documentId, base.getTemplateId());
        if (existing.isPresent()) {
            VariantProposalRecord record = existing.get();
            log.debug("Document {} already proposed a variant of {} (proposal {})",
                    documentId, base.getTemplateId(), record.getId());
            return record.getStatus() == VariantProposal.Status.PENDING ? submit(record) : record.toModel();
        }

        return submit(proposalRepo.save(VariantProposalRecord.builder()
                .applicationId(base.getApplicationId())
                .baseTemplateId(base.getTemplateId())
                .proposedLabel(base.getLabel() + " (variant)")
                .documentId(documentId)
                .observedSignature(observed)
                .similarity(similarity)
                .status(VariantProposal.Status.PENDING)
                .createdAt(clock.instant())
                .build()));
    }

    private VariantProposal submit(VariantProposalRecord record) {
        try {
            syncClient.submitProposal(record.toModel());
            record.setStatus(VariantProposal.Status.SUBMITTED);
            record.setSubmittedAt(clock.instant());
            record = proposalRepo.save(record);
        } catch (TemplateSyncException e) {
            log.warn("Variant proposal {} for template {} kept pending: {}",
                    record.getId(), record.getBaseTemplateId(), e.getMessage());
        }
        return record.toModel();
    }

    public List<VariantProposal> proposals(String applicationId) {
        return proposalRepo.findByApplicationIdOrderByCreatedAtDesc(applicationId).stream()
                .map(VariantProposalRecord::toModel)
                .toList();
    }

    // ─── LOADING ───────────────────────────────────────────────────────

    private List<Template> load(String applicationId, boolean force) {
        ReentrantLock lock = refreshLocks.computeIfAbsent(applicationId, k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(config.getRefreshLockTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cachedOrMirrored(applicationId);
        }
        if (!acquired) {
            log.warn("Template refresh for {} still running elsewhere, serving cached templates", applicationId);
            return cachedOrMirrored(applicationId);
        }

        try {
            Snapshot current = snapshots.get(applicationId);
            // another reader may have refreshed while this one waited
            if (!force && current != null && current.isFresh(clock.instant())) {
                return current.templates;
            }

            try {
                List<Template> templates = mirror(applicationId, syncClient.fetchTemplates(applicationId));
                snapshots.put(applicationId, new Snapshot(templates, clock.instant().plus(config.getCacheTtl())));
                log.info("Loaded {} templates for application {}", templates.size(), applicationId);
                return templates;
            } catch (TemplateSyncException e) {
                List<Template> fallback = cachedOrMirrored(applicationId);
                log.warn("Template sync failed for {}, serving {} cached templates: {}",
                        applicationId, fallback.size(), e.getMessage());
                snapshots.put(applicationId, new Snapshot(fallback, clock.instant().plus(RETRY_AFTER_FAILURE)));
                return fallback;
            }
        } finally {
            lock.unlock();
        }
    }

    private List<Template> cachedOrMirrored(String applicationId) {
        Snapshot current = snapshots.get(applicationId);
        if (current != null) return current.templates;
        return templateRepo.findByApplicationIdOrderByIdAsc(applicationId).stream()
                .map(DocumentTemplate::toModel)
                .toList();
    }

    /**
     * Makes the local mirror equal to what the business system returned.
     */
    private List<Template> mirror(String applicationId, List<TemplateDefinition> definitions) {
        Map<String, DocumentTemplate> existing = templateRepo.findByApplicationIdOrderByIdAsc(applicationId).stream()
                .collect(Collectors.toMap(DocumentTemplate::getTemplateId, Function.identity(), (a, b) -> a));

        List<DocumentTemplate> toSave = new ArrayList<>();
        for (TemplateDefinition definition : definitions) {
            toSave.add(toEntity(applicationId, definition, existing.get(definition.getTemplateId())));
        }
        List<DocumentTemplate> saved = templateRepo.saveAll(toSave);

        Set<String> pulled = definitions.stream().map(TemplateDefinition::getTemplateId).collect(Collectors.toSet());
        List<DocumentTemplate> removed = existing.values().stream()
                .filter(t -> !pulled.contains(t.getTemplateId()))
                .toList();
        if (!removed.isEmpty()) {
            templateRepo.deleteAll(removed);
            log.info("Removed {} templates no longer served for application {}", removed.size(), applicationId);
        }

        return saved.stream().map(DocumentTemplate::toModel).toList();
    }

    private DocumentTemplate toEntity(String applicationId, TemplateDefinition definition, DocumentTemplate existing) {
        DocumentTemplate entity = existing != null ? existing : new DocumentTemplate();
        entity.setApplicationId(applicationId);
        entity.setTemplateId(definition.getTemplateId());
        entity.setDocumentType(definition.getDocumentType());
        entity.setVendor(definition.getVendor());
        entity.setFormatName(definition.getFormatName());
        entity.setVersion(definition.getVersion());
        entity.setSignature(definition.getSignature());
        entity.setFieldMap(definition.getFieldMap() != null ? new ArrayList<>(definition.getFieldMap()) : new ArrayList<>());
        entity.setUpdatedAt(definition.getUpdatedAt());
        entity.setSyncedAt(clock.instant());
        return entity;
    }

    private static final class Snapshot {
        final List<Template> templates;
        final Instant expiresAt;

        Snapshot(List<Template> templates, Instant expiresAt) {
            this.templates = templates;
            this.expiresAt = expiresAt;
        }

        boolean isFresh(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
