package org.netpreserve.scriptorium.config;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Candidate source settings.
 *
 * @param delimiter    column separator for delimited sources
 * @param doiResolver  prefix turning a DOI into a URL hint, or null to not use DOIs as hints
 * @param bibcodeHints URL templates filled with a record's bibcode, each containing {@value #BIBCODE}
 */
public record SourceConfig(
        String delimiter,
        @Nullable String doiResolver,
        @Nullable List<String> bibcodeHints) {

    public static final String BIBCODE = "{bibcode}";
    public static final String ADS_GATEWAY = "https://ui.adsabs.harvard.edu/link_gateway/" + BIBCODE + "/PUB_PDF";

    public char delimiterChar() {
        return delimiter.charAt(0);
    }

    public List<String> bibcodeUrls(String bibcode) {
        if (bibcodeHints == null) return List.of();
        return bibcodeHints.stream().map(template -> expand(template, bibcode)).toList();
    }

    public static String expand(String template, String bibcode) {
        return template.replace(BIBCODE, bibcode);
    }
}
