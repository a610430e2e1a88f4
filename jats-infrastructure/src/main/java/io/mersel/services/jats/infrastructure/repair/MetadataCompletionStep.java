package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.Clock;
import java.time.Year;
import java.util.Map;

/**
 * Ön madde metadata'sını tamamlar ve sıralar.
 * <p>
 * {@code front}, {@code journal-meta} ve {@code article-meta} yoksa oluşturur,
 * {@code article-meta} çocuklarını gramer sırasına dizer ve PMC'nin zorunlu tuttuğu
 * eksik elementler için en küçük yer tutucuları sırasına uygun konuma ekler:
 * makale başlığı, yayın yılı, konum tanımlayıcısı ({@code elocation-id}), dergi kimliği,
 * dergi adı, ISSN ve yayıncı. Var olan hiçbir elementi çoğaltmaz.
 */
@Component
public class MetadataCompletionStep implements IRepairStep {

    static final String NAME = "metadata-completion";

    private final RepairProperties properties;
    private final Clock clock;

    @Autowired
    public MetadataCompletionStep(RepairProperties properties) {
        this(properties, Clock.systemDefaultZone());
    }

    MetadataCompletionStep(RepairProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int order() {
        return 30;
    }

    @Override
    public void apply(RepairContext context) {
        Element root = context.root();
        if (!"article".equals(root.getNodeName())) {
            return;
        }

        Tracker tracker = new Tracker(context);
        Element front = ensureFront(root, tracker);
        Element journalMeta = ensureChild(front, "journal-meta", FrontMatterLayout.FRONT, tracker);
        Element articleMeta = ensureChild(front, "article-meta", FrontMatterLayout.FRONT, tracker);

        completeJournalMeta(journalMeta, tracker);

        if (FrontMatterLayout.reorder(articleMeta, FrontMatterLayout.ARTICLE_META)) {
            tracker.repaired("article-meta çocukları gramer sırasına dizildi", articleMeta);
        }
        completeArticleMeta(articleMeta, tracker);

        if (tracker.changed) {
            context.treeModified();
        }
    }

    // ── journal-meta ────────────────────────────────────────────────

    private void completeJournalMeta(Element journalMeta, Tracker tracker) {
        Document doc = journalMeta.getOwnerDocument();
        RepairProperties.Metadata defaults = properties.getMetadata();

        if (XmlNodes.firstChild(journalMeta, "journal-id") == null) {
            Element journalId = XmlNodes.create(doc, "journal-id", defaults.getJournalId());
            journalId.setAttribute("journal-id-type", defaults.getJournalIdType());
            insert(journalMeta, journalId, FrontMatterLayout.JOURNAL_META, tracker);
        }

        Element titleGroup = XmlNodes.firstChild(journalMeta, "journal-title-group");
        if (titleGroup == null) {
            titleGroup = XmlNodes.create(doc, "journal-title-group");
            titleGroup.appendChild(XmlNodes.create(doc, "journal-title", defaults.getJournalTitle()));
            insert(journalMeta, titleGroup, FrontMatterLayout.JOURNAL_META, tracker);
        } else if (XmlNodes.firstChild(titleGroup, "journal-title") == null) {
            titleGroup.insertBefore(XmlNodes.create(doc, "journal-title", defaults.getJournalTitle()), titleGroup.getFirstChild());
            tracker.repaired("Yer tutucu journal-title eklendi", titleGroup);
        }

        if (XmlNodes.firstChild(journalMeta, "issn") == null) {
            Element issn = XmlNodes.create(doc, "issn", defaults.getIssn());
            issn.setAttribute("publication-format", "electronic");
            insert(journalMeta, issn, FrontMatterLayout.JOURNAL_META, tracker);
        }

        if (XmlNodes.firstChild(journalMeta, "publisher") == null) {
            Element publisher = XmlNodes.create(doc, "publisher");
            publisher.appendChild(XmlNodes.create(doc, "publisher-name", defaults.getPublisherName()));
            insert(journalMeta, publisher, FrontMatterLayout.JOURNAL_META, tracker);
        }
    }

    // ── article-meta ────────────────────────────────────────────────

    private void completeArticleMeta(Element articleMeta, Tracker tracker) {
        Document doc = articleMeta.getOwnerDocument();

        Element titleGroup = XmlNodes.firstChild(articleMeta, "title-group");
        if (titleGroup == null) {
            titleGroup = XmlNodes.create(doc, "title-group");
            titleGroup.appendChild(XmlNodes.create(doc, "article-title"));
            insert(articleMeta, titleGroup, FrontMatterLayout.ARTICLE_META, tracker);
        } else if (XmlNodes.firstChild(titleGroup, "article-title") == null) {
            titleGroup.insertBefore(XmlNodes.create(doc, "article-title"), titleGroup.getFirstChild());
            tracker.repaired("Boş article-title eklendi", titleGroup);
        }

        if (XmlNodes.firstChild(articleMeta, "pub-date") == null
                && XmlNodes.firstChild(articleMeta, "pub-date-not-available") == null) {
            Element pubDate = XmlNodes.create(doc, "pub-date");
            pubDate.setAttribute("publication-format", "electronic");
            pubDate.setAttribute("date-type", "pub");
            pubDate.appendChild(XmlNodes.create(doc, "year", String.valueOf(Year.now(clock).getValue())));
            insert(articleMeta, pubDate, FrontMatterLayout.ARTICLE_META, tracker);
        }

        if (XmlNodes.firstChild(articleMeta, "fpage") == null
                && XmlNodes.firstChild(articleMeta, "elocation-id") == null) {
            Element elocation = XmlNodes.create(doc, "elocation-id", properties.getMetadata().getElocationId());
            insert(articleMeta, elocation, FrontMatterLayout.ARTICLE_META, tracker);
        }
    }

    // ── Yardımcılar ─────────────────────────────────────────────────

    private Element ensureFront(Element article, Tracker tracker) {
        Element front = XmlNodes.firstChild(article, "front");
        if (front != null) {
            return front;
        }
        front = XmlNodes.create(article.getOwnerDocument(), "front");
        article.insertBefore(front, XmlNodes.childElements(article).stream().findFirst().orElse(null));
        tracker.repaired("Eksik front elementi oluşturuldu", front);
        return front;
    }

    private Element ensureChild(Element parent, String name, Map<String, Integer> order, Tracker tracker) {
        Element child = XmlNodes.firstChild(parent, name);
        if (child != null) {
            return child;
        }
        child = XmlNodes.create(parent.getOwnerDocument(), name);
        insert(parent, child, order, tracker);
        return child;
    }

    private void insert(Element parent, Element child, Map<String, Integer> order, Tracker tracker) {
        FrontMatterLayout.insertInOrder(parent, child, order);
        tracker.repaired("Yer tutucu " + child.getNodeName() + " eklendi", child);
    }

    /**
     * Değişiklikleri günlüğe yazar ve ağacın değişip değişmediğini izler.
     */
    private static final class Tracker {
        private final RepairContext context;
        private boolean changed;

        private Tracker(RepairContext context) {
            this.context = context;
        }

        private void repaired(String message, Element where) {
            changed = true;
            context.log().repair(NAME, message, XmlNodes.path(where));
        }
    }
}
