package io.mersel.services.jats.application.models;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ağaçtaki {@code id} değerlerinden sahip elemente eşleme.
 * <p>
 * Tek geçişte belge sırasıyla oluşturulur; aynı id birden fazla kez
 * geçiyorsa ilk element kazanır ve id {@link #duplicates()} kümesine eklenir.
 * Ağaç değiştiğinde geçersiz olur, bkz. {@link RepairContext#treeModified()}.
 */
public final class IdRegistry {

    private final Map<String, Element> byId;
    private final Set<String> duplicates;

    private IdRegistry(Map<String, Element> byId, Set<String> duplicates) {
        this.byId = Collections.unmodifiableMap(byId);
        this.duplicates = Collections.unmodifiableSet(duplicates);
    }

    public static IdRegistry scan(Document document) {
        Map<String, Element> byId = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        NodeList all = document.getElementsByTagName("*");
        for (int i = 0; i < all.getLength(); i++) {
            Element element = (Element) all.item(i);
            if (!element.hasAttribute("id")) {
                continue;
            }
            String id = element.getAttribute("id");
            if (byId.putIfAbsent(id, element) != null) {
                duplicates.add(id);
            }
        }
        return new IdRegistry(byId, duplicates);
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public Optional<Element> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Büyük/küçük harf duyarsız tekil eşleşme ("Ref1" → "ref1").
     * Birden fazla aday varsa boş döner.
     */
    public Optional<String> findIgnoreCase(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String wanted = id.toLowerCase(Locale.ROOT);
        List<String> matches = byId.keySet().stream()
                .filter(candidate -> candidate.toLowerCase(Locale.ROOT).equals(wanted))
                .toList();
        return matches.size() == 1 ? Optional.of(matches.get(0)) : Optional.empty();
    }

    public Set<String> ids() {
        return byId.keySet();
    }

    public Set<String> duplicates() {
        return duplicates;
    }

    public int size() {
        return byId.size();
    }
}
