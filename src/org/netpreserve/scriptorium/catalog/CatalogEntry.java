package org.netpreserve.scriptorium.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.config.SourceConfig;
import org.netpreserve.scriptorium.util.Rows;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A row of a bibliographic catalog. Fields are kept as written; comparisons go through the normalizing
 * accessors.
 */
@JsonPropertyOrder({"title", "year", "bibcode", "doi", "url_hint"})
public record CatalogEntry(
        @Nullable String title,
        @Nullable String year,
        @Nullable String bibcode,
        @Nullable String doi,
        @JsonProperty("url_hint") @Nullable String urlHint) {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    static CatalogEntry fromRow(Map<String, ?> raw) {
        Map<String, String> row = Rows.normalize(raw);
        String bibcode = row.get("bibcode");
        if (bibcode == null) bibcode = row.get("identifier");
        String urlHint = row.get("url_hint");
        if (urlHint == null) urlHint = row.get("url");
        return new CatalogEntry(row.get("title"), row.get("year"), bibcode, row.get("doi"), urlHint);
    }

    /**
     * This entry with its URL hint filled from the bibcode when it has none.
     */
    public CatalogEntry withBibcodeHint(String template) {
        if (urlHint != null || bibcode == null) return this;
        return new CatalogEntry(title, year, bibcode, doi, SourceConfig.expand(template, bibcode));
    }

    /**
     * Lower-cased title with punctuation replaced by spaces and whitespace collapsed.
     */
    public String normalizedTitle() {
        if (title == null) return "";
        String s = PUNCTUATION.matcher(title.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(s).replaceAll(" ").strip();
    }

    /**
     * The year's first four characters as a number, or null. Tolerates spreadsheet floats like "1905.0".
     */
    public @Nullable Integer yearNumber() {
        if (year == null || year.length() < 4) return null;
        try {
            return Integer.valueOf(year.substring(0, 4));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public @Nullable String normalizedDoi() {
        return doi == null ? null : doi.strip().toLowerCase(Locale.ROOT);
    }
}
