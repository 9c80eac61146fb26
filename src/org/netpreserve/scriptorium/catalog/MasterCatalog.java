package org.netpreserve.scriptorium.catalog;

import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The locally held catalog, indexed for the three ways a candidate can already be in it: same bibcode, same
 * DOI, or same normalized title within a year either side.
 */
public class MasterCatalog {
    private final Set<String> bibcodes = new HashSet<>();
    private final Set<String> dois = new HashSet<>();
    private final Set<TitleYear> titles = new HashSet<>();
    private final int size;

    public MasterCatalog(List<CatalogEntry> entries) {
        for (CatalogEntry entry : entries) {
            if (entry.bibcode() != null) bibcodes.add(entry.bibcode());
            if (entry.normalizedDoi() != null) dois.add(entry.normalizedDoi());
            String title = entry.normalizedTitle();
            Integer year = entry.yearNumber();
            for (int delta = -1; delta <= 1; delta++) {
                titles.add(new TitleYear(title, year == null ? null : year + delta));
            }
        }
        this.size = entries.size();
    }

    public boolean contains(CatalogEntry candidate) {
        if (candidate.bibcode() != null && bibcodes.contains(candidate.bibcode())) return true;
        String doi = candidate.normalizedDoi();
        if (doi != null && dois.contains(doi)) return true;
        return titles.contains(new TitleYear(candidate.normalizedTitle(), candidate.yearNumber()));
    }

    public int size() {
        return size;
    }

    private record TitleYear(String title, @Nullable Integer year) {
    }
}
