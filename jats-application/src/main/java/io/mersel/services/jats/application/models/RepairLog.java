package io.mersel.services.jats.application.models;

import io.mersel.services.jats.application.enums.RepairEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tek bir belge için onarım olaylarını biriktiren günlük.
 * <p>
 * Her adıma {@link RepairContext} üzerinden geçirilir ve sonunda uyumluluk
 * raporuna aktarılır. Olaylar aynı zamanda SLF4J'ye de yazılır; rapor ise
 * bu listeden üretilir, log çıktısından değil.
 * <p>
 * Thread-safe değildir, belge başına bir örnek oluşturulur.
 */
public final class RepairLog {

    private static final Logger log = LoggerFactory.getLogger(RepairLog.class);

    private final List<RepairEvent> events = new ArrayList<>();

    public void notice(String step, String message, String location) {
        record(new RepairEvent(step, RepairEventType.INPUT_NOTICE, message, location));
    }

    public void repair(String step, String message, String location) {
        record(new RepairEvent(step, RepairEventType.STRUCTURAL_REPAIR, message, location));
    }

    public void ambiguity(String step, String message, String location) {
        record(new RepairEvent(step, RepairEventType.RESOLUTION_AMBIGUITY, message, location));
    }

    public void record(RepairEvent event) {
        events.add(event);
        String where = event.location() == null ? "" : " @ " + event.location();
        if (event.type() == RepairEventType.STRUCTURAL_REPAIR) {
            log.info("[{}] {}{}", event.step(), event.message(), where);
        } else {
            log.warn("[{}] {}{}", event.step(), event.message(), where);
        }
    }

    public List<RepairEvent> events() {
        return List.copyOf(events);
    }

    public List<RepairEvent> ofType(RepairEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    /**
     * Belirli bir adımın belirli türdeki olay sayısı (metrikler için).
     */
    public long count(String step, RepairEventType type) {
        return events.stream()
                .filter(e -> e.type() == type && e.step().equals(step))
                .count();
    }

    public int size() {
        return events.size();
    }
}
