package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JATS Journal Publishing ön madde elementlerinin gramer sırası.
 * <p>
 * Aynı sıra değerini paylaşan elementler (örn: {@code contrib-group} ve {@code aff})
 * kendi aralarında serbestçe karışabilir. Tabloda olmayan elementlerin sırası yoktur,
 * önlerindeki kardeşle birlikte hareket ederler.
 */
final class FrontMatterLayout {

    static final Map<String, Integer> FRONT = ranks(List.of(
            List.of("journal-meta"),
            List.of("article-meta"),
            List.of("def-list", "list", "ack", "bio", "fn-group", "glossary", "notes")
    ));

    static final Map<String, Integer> JOURNAL_META = ranks(List.of(
            List.of("journal-id"),
            List.of("journal-title-group"),
            List.of("contrib-group", "aff", "aff-alternatives"),
            List.of("issn"),
            List.of("issn-l"),
            List.of("isbn"),
            List.of("publisher"),
            List.of("notes"),
            List.of("self-uri"),
            List.of("custom-meta-group")
    ));

    static final Map<String, Integer> ARTICLE_META = ranks(List.of(
            List.of("article-id"),
            List.of("article-version", "article-version-alternatives"),
            List.of("article-categories"),
            List.of("title-group"),
            List.of("contrib-group", "aff", "aff-alternatives"),
            List.of("author-notes"),
            List.of("pub-date", "pub-date-not-available"),
            List.of("volume"),
            List.of("volume-id"),
            List.of("volume-series"),
            List.of("issue"),
            List.of("issue-id"),
            List.of("issue-title"),
            List.of("issue-title-group"),
            List.of("issue-sponsor"),
            List.of("issue-part"),
            List.of("volume-issue-group"),
            List.of("isbn"),
            List.of("supplement"),
            List.of("fpage"),
            List.of("lpage"),
            List.of("page-range"),
            List.of("elocation-id"),
            List.of("email", "ext-link", "uri", "product", "supplementary-material"),
            List.of("history"),
            List.of("pub-history"),
            List.of("permissions"),
            List.of("self-uri"),
            List.of("related-article", "related-object"),
            List.of("abstract"),
            List.of("trans-abstract"),
            List.of("kwd-group"),
            List.of("funding-group"),
            List.of("support-group"),
            List.of("conference"),
            List.of("counts"),
            List.of("custom-meta-group")
    ));

    private FrontMatterLayout() {
    }

    /**
     * Yeni elementi, sırası kendisinden büyük ilk mevcut kardeşin önüne ekler;
     * böyle bir kardeş yoksa sona ekler.
     */
    static void insertInOrder(Element parent, Element child, Map<String, Integer> order) {
        Integer rank = order.get(child.getNodeName());
        if (rank != null) {
            for (Element sibling : XmlNodes.childElements(parent)) {
                Integer siblingRank = order.get(sibling.getNodeName());
                if (siblingRank != null && siblingRank > rank) {
                    parent.insertBefore(child, sibling);
                    return;
                }
            }
        }
        parent.appendChild(child);
    }

    /**
     * Çocuk elementleri gramer sırasına dizer. Zaten sıralıysa ağaca dokunmaz.
     * Her element kendinden sonraki element-dışı düğümlerle (boşluk, yorum) birlikte taşınır.
     *
     * @return Sıralama değiştiyse {@code true}
     */
    static boolean reorder(Element parent, Map<String, Integer> order) {
        List<Unit> units = new ArrayList<>();
        int effectiveRank = -1;
        Unit current = null;
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                Integer rank = order.get(n.getNodeName());
                if (rank != null) {
                    effectiveRank = rank;
                }
                current = new Unit(effectiveRank, units.size());
                units.add(current);
            }
            if (current != null) {
                current.nodes.add(n);
            }
        }

        boolean sorted = true;
        for (int i = 1; i < units.size(); i++) {
            if (units.get(i).rank < units.get(i - 1).rank) {
                sorted = false;
                break;
            }
        }
        if (sorted) {
            return false;
        }

        List<Unit> ordered = new ArrayList<>(units);
        ordered.sort(Comparator.comparingInt((Unit u) -> u.rank).thenComparingInt(u -> u.position));
        for (Unit unit : ordered) {
            for (Node n : unit.nodes) {
                parent.appendChild(n);
            }
        }
        return true;
    }

    private static Map<String, Integer> ranks(List<List<String>> groups) {
        Map<String, Integer> ranks = new HashMap<>();
        for (int i = 0; i < groups.size(); i++) {
            for (String name : groups.get(i)) {
                ranks.put(name, i);
            }
        }
        return Map.copyOf(ranks);
    }

    private static final class Unit {
        private final int rank;
        private final int position;
        private final List<Node> nodes = new ArrayList<>();

        private Unit(int rank, int position) {
            this.rank = rank;
            this.position = position;
        }
    }
}
