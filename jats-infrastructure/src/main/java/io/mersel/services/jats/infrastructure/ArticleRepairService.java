package io.mersel.services.jats.infrastructure;

import io.mersel.services.jats.application.enums.RepairEventType;
import io.mersel.services.jats.application.interfaces.ArticleParseException;
import io.mersel.services.jats.application.interfaces.IArticleLoader;
import io.mersel.services.jats.application.interfaces.IArticleRepairService;
import io.mersel.services.jats.application.interfaces.IArticleSerializer;
import io.mersel.services.jats.application.interfaces.IComplianceReporter;
import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.interfaces.IRepairSuggestionProvider;
import io.mersel.services.jats.application.models.ComplianceReport;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.application.models.RepairEvent;
import io.mersel.services.jats.application.models.RepairLog;
import io.mersel.services.jats.application.models.RepairResult;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.diagnostics.RepairMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JATS makale onarım hattı.
 * <p>
 * Tek belge için senkron çalışır:
 * <ol>
 *   <li>Yükleme (tek ölümcül aşama; isteğe bağlı harici öneri önce denenir)</li>
 *   <li>{@link IRepairStep} adımları {@code order()} sırasıyla</li>
 *   <li>İki varyantın serileştirilmesi</li>
 *   <li>Uyumluluk raporu</li>
 * </ol>
 * Adımlar ağacı yerinde değiştirir; belge başına durum yalnızca {@link RepairContext}'tedir.
 */
@Service
public class ArticleRepairService implements IArticleRepairService {

    private static final Logger log = LoggerFactory.getLogger(ArticleRepairService.class);

    static final String SUGGESTION_STEP = "suggestion";

    private final IArticleLoader loader;
    private final List<IRepairStep> steps;
    private final IArticleSerializer serializer;
    private final IComplianceReporter reporter;
    private final RepairProperties properties;
    private final RepairMetrics metrics;
    private final ObjectProvider<IRepairSuggestionProvider> suggestionProvider;

    public ArticleRepairService(IArticleLoader loader,
                                List<IRepairStep> steps,
                                IArticleSerializer serializer,
                                IComplianceReporter reporter,
                                RepairProperties properties,
                                RepairMetrics metrics,
                                ObjectProvider<IRepairSuggestionProvider> suggestionProvider) {
        this.loader = loader;
        this.steps = steps.stream()
                .sorted(Comparator.comparingInt(IRepairStep::order))
                .toList();
        this.serializer = serializer;
        this.reporter = reporter;
        this.properties = properties;
        this.metrics = metrics;
        this.suggestionProvider = suggestionProvider;
        log.info("Onarım hattı: {}", this.steps.stream()
                .map(s -> s.order() + ":" + s.getName())
                .collect(Collectors.joining(", ")));
    }

    /** Çalışma sırasındaki adımlar. */
    public List<IRepairStep> getSteps() {
        return steps;
    }

    @Override
    public RepairResult repair(byte[] input) throws ArticleParseException {
        long startTime = System.nanoTime();
        RepairLog repairLog = new RepairLog();

        Document document = load(input, repairLog);
        RepairContext context = new RepairContext(document, repairLog);

        for (IRepairStep step : steps) {
            step.apply(context);
            metrics.recordStep(step.getName(),
                    repairLog.count(step.getName(), RepairEventType.STRUCTURAL_REPAIR),
                    repairLog.count(step.getName(), RepairEventType.RESOLUTION_AMBIGUITY));
        }

        byte[] schemaVariant = serializer.toSchemaVariant(document);
        byte[] dtdVariant = serializer.toDtdVariant(document);
        ComplianceReport report = reporter.report(document, repairLog);

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        metrics.recordPipeline(report.getStatus().name(), durationMs);
        log.info("Makale onarıldı: durum={}, {} düzeltme, {} belirsizlik, {} ms",
                report.getStatus(), report.getRepairs().size(), report.getAmbiguities().size(), durationMs);

        return RepairResult.builder()
                .schemaVariant(schemaVariant)
                .dtdVariant(dtdVariant)
                .report(report)
                .durationMs(durationMs)
                .build();
    }

    // ── Yükleme ─────────────────────────────────────────────────────

    private Document load(byte[] input, RepairLog repairLog) throws ArticleParseException {
        Optional<Document> suggested = loadSuggestion(input, repairLog);
        if (suggested.isPresent()) {
            return suggested.get();
        }
        try {
            return loader.load(input, repairLog);
        } catch (ArticleParseException e) {
            metrics.recordParseFailure();
            log.error("Makale ayrıştırılamadı: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Harici öneri etkinse ve sağlayıcı varsa öneriyi yüklemeyi dener.
     * Öneri alınamaz veya yüklenemezse bildirim yazılır ve özgün girdiye dönülür.
     */
    private Optional<Document> loadSuggestion(byte[] input, RepairLog repairLog) {
        if (!properties.getSuggestions().isEnabled()) {
            return Optional.empty();
        }
        IRepairSuggestionProvider provider = suggestionProvider.getIfAvailable();
        if (provider == null) {
            log.debug("Öneri etkin ama sağlayıcı bean'i yok");
            return Optional.empty();
        }

        Optional<String> suggestion;
        try {
            suggestion = provider.suggest(new String(input, StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            log.warn("Onarım önerisi alınamadı, özgün girdi kullanılıyor: {}", e.getMessage());
            repairLog.notice(SUGGESTION_STEP, "Onarım önerisi alınamadı, özgün girdi kullanıldı: " + e.getMessage(), null);
            return Optional.empty();
        }
        if (suggestion.isEmpty()) {
            return Optional.empty();
        }

        RepairLog attempt = new RepairLog();
        try {
            Document document = loader.load(suggestion.get().getBytes(StandardCharsets.UTF_8), attempt);
            for (RepairEvent event : attempt.events()) {
                repairLog.record(event);
            }
            repairLog.notice(SUGGESTION_STEP, "Harici onarım önerisi kullanıldı", null);
            return Optional.of(document);
        } catch (ArticleParseException e) {
            repairLog.notice(SUGGESTION_STEP, "Onarım önerisi ayrıştırılamadı, özgün girdi kullanıldı: " + e.getMessage(), null);
            return Optional.empty();
        }
    }
}
