package de.bsommerfeld.triage.engine;

import com.google.inject.Inject;
import de.bsommerfeld.triage.core.config.SimilarityConfig;
import de.bsommerfeld.triage.core.config.TriageConfig;
import de.bsommerfeld.triage.core.config.TriageConfigurationException;
import de.bsommerfeld.triage.core.domain.Message;
import de.bsommerfeld.triage.core.domain.MessageRecord;
import de.bsommerfeld.triage.core.domain.SimilarityMatch;
import de.bsommerfeld.triage.core.event.ApplicationEventBus;
import de.bsommerfeld.triage.core.event.TriageEvents.MessageTriagedEvent;
import de.bsommerfeld.triage.core.event.TriageEvents.RecordSkippedEvent;
import de.bsommerfeld.triage.engine.analytics.AnalyticsService;
import de.bsommerfeld.triage.engine.analytics.AutomationAdvisor;
import de.bsommerfeld.triage.engine.analytics.AutomationSuggestion;
import de.bsommerfeld.triage.engine.analytics.BatchSummary;
import de.bsommerfeld.triage.engine.export.OutputRecord;
import de.bsommerfeld.triage.engine.similarity.KeyPhraseExtractor;
import de.bsommerfeld.triage.engine.similarity.SimilarityEngine;
import de.bsommerfeld.triage.engine.similarity.SimilarityStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * The triage pipeline: categorize, score, search for similar messages, store.
 *
 * <p>
 * Each engine owns its {@link MessageStore}. Later messages are compared
 * against everything processed before them, so processing order matters and
 * is preserved. The similarity search and the append that follows it run
 * under one lock: concurrent callers always see each other's messages and
 * never observe a half-finished append.
 */
public class TriageEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TriageEngine.class);

    private final TriageConfig config;
    private final CategoryRuleSet rules;
    private final Categorizer categorizer;
    private final PriorityScorer priorityScorer;
    private final MessageStore store = new MessageStore();
    private final SimilarityEngine similarityEngine;
    private final AnalyticsService analytics;
    private final MessageFactory messageFactory;
    private final ApplicationEventBus eventBus;
    private final ReentrantLock storeLock = new ReentrantLock();

    /**
     * @throws TriageConfigurationException if the configuration cannot
     *                                      produce a well-defined engine
     */
    @Inject
    public TriageEngine(TriageConfig config, SimilarityStrategy strategy, ApplicationEventBus eventBus,
            Clock clock) {
        SimilarityConfig similarity = config.getSimilarity();
        if (similarity.getTopK() < 0)
            throw new TriageConfigurationException("top-k must not be negative: " + similarity.getTopK());

        this.config = config;
        this.rules = CategoryRuleSet.compile(config);
        this.categorizer = new Categorizer(rules, config.getConfidenceNormalization(),
                config.getFallbackConfidence());
        this.priorityScorer = new PriorityScorer(config.getPriority(), rules, clock);
        this.similarityEngine = new SimilarityEngine(store, strategy,
                new KeyPhraseExtractor(similarity.getKeyPhraseMinWordLength(), similarity.getMaxKeyPhrases()));
        this.analytics = new AnalyticsService(config.getAnalytics(), rules.names(), clock);
        this.messageFactory = new MessageFactory(clock);
        this.eventBus = eventBus;

        LOG.info("Triage engine ready: {} categories, similarity threshold {}", rules.names().size(),
                strategy.threshold());
    }

    /**
     * Runs one record through the whole pipeline and stores the result.
     */
    public Message process(MessageRecord record) {
        Message message = messageFactory.create(record);

        Categorization categorization = categorizer.categorize(message.getText());
        message.setCategorization(categorization.category(), categorization.confidence());
        message.setPriorityScore(priorityScorer.score(message, categorization.category()));

        storeLock.lock();
        try {
            message.setSimilarMessages(
                    similarityEngine.findSimilar(message, config.getSimilarity().getTopK()));
            store.append(message);
            similarityEngine.index(message);
        } finally {
            storeLock.unlock();
        }

        LOG.info("Processed message: {} -> Category: {}, Priority: {}", message.getId(),
                message.getCategory(), String.format("%.2f", message.getPriorityScore()));
        eventBus.post(new MessageTriagedEvent(message));
        return message;
    }

    /**
     * Processes records strictly in input order. A record that fails is
     * logged, announced as {@link RecordSkippedEvent} and left out; the rest
     * of the batch continues. Callers detect partial failure by comparing
     * sizes.
     *
     * @return the successfully processed messages, in input order
     */
    public List<Message> processBatch(List<MessageRecord> records) {
        List<Message> processed = new ArrayList<>(records.size());
        for (MessageRecord record : records) {
            try {
                processed.add(process(record));
            } catch (RuntimeException e) {
                LOG.error("Error processing message {}, skipping", record != null ? record.id() : null, e);
                eventBus.post(new RecordSkippedEvent(record, String.valueOf(e.getMessage())));
            }
        }
        if (processed.size() < records.size()) {
            LOG.warn("Batch finished with {} of {} records processed", processed.size(), records.size());
        }
        return processed;
    }

    public Categorization categorize(String text) {
        return categorizer.categorize(text);
    }

    /**
     * Searches the current store for messages similar to {@code message}
     * without storing it.
     */
    public List<SimilarityMatch> findSimilar(Message message, int topK) {
        storeLock.lock();
        try {
            return similarityEngine.findSimilar(message, topK);
        } finally {
            storeLock.unlock();
        }
    }

    /** Every processed message, in processing order. */
    public List<Message> messages() {
        return store.all();
    }

    public BatchSummary summary() {
        return analytics.summarize(store.all());
    }

    public List<AutomationSuggestion> suggestions() {
        return AutomationAdvisor.suggest(summary());
    }

    public List<OutputRecord> export() {
        int previewLength = config.getAnalytics().getPreviewLength();
        return store.all().stream()
                .map(m -> OutputRecord.from(m, rules.colorOf(m.getCategory()), previewLength))
                .collect(Collectors.toList());
    }

    public CategoryRuleSet rules() {
        return rules;
    }
}
