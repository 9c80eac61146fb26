package org.netpreserve.scriptorium;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.config.SourceConfig;
import org.netpreserve.scriptorium.util.Rows;
import org.netpreserve.scriptorium.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads bibliographic records and turns them into fetch candidates. Loading is deterministic: reading the same
 * source twice yields the same candidates in the same order.
 */
public class CandidateLoader {
    private static final Logger log = LoggerFactory.getLogger(CandidateLoader.class);
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {
    };
    private static final List<String> IDENTIFIER_COLUMNS = List.of("identifier", "bibcode", "id");
    private static final List<String> URL_COLUMNS = List.of("url_hint", "url_hints", "urls", "url");
    private static final Pattern YEAR_PATTERN = Pattern.compile("^\\s*(\\d{4})");
    private static final Pattern URL_SEPARATOR = Pattern.compile("[\\s|;]+");
    private static final Pattern DOI_PREFIX = Pattern.compile("(?i)^(?:doi:|https?://(?:dx\\.)?doi\\.org/)");

    private final SourceConfig config;
    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public CandidateLoader(SourceConfig config) {
        this.config = config;
    }

    public List<Candidate> load(Path source) throws ConfigurationException {
        List<Map<String, Object>> rows = readRows(source);
        var candidates = new ArrayList<Candidate>();
        var seen = new HashSet<String>();
        for (int i = 0; i < rows.size(); i++) {
            Candidate candidate = toCandidate(Rows.normalize(rows.get(i)), i + 1);
            if (candidate == null) continue;
            if (!seen.add(candidate.identifier())) {
                log.warn("Record {}: duplicate identifier {}, keeping the first occurrence", i + 1,
                        candidate.identifier());
                continue;
            }
            candidates.add(candidate);
        }
        log.info("Loaded {} candidates from {} records in {}", candidates.size(), rows.size(), source);
        return candidates;
    }

    private List<Map<String, Object>> readRows(Path source) throws ConfigurationException {
        String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectReader reader;
        if (name.endsWith(".jsonl") || name.endsWith(".json")) {
            reader = jsonMapper.readerFor(ROW_TYPE);
        } else {
            CsvSchema schema = CsvSchema.emptySchema()
                    .withHeader()
                    .withColumnSeparator(config.delimiterChar());
            reader = csvMapper.readerFor(ROW_TYPE).with(schema);
        }
        try (MappingIterator<Map<String, Object>> iterator = reader.readValues(source.toFile())) {
            return iterator.readAll();
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read candidate source " + source + ": " + e.getMessage(), e);
        }
    }

    private @Nullable Candidate toCandidate(Map<String, String> row, int recordNumber) {
        String identifier = first(row, IDENTIFIER_COLUMNS);
        if (identifier == null) {
            log.warn("Record {}: no identifier, dropped", recordNumber);
            return null;
        }
        String title = row.get("title");
        if (title == null) {
            log.warn("Record {} ({}): no title, dropped", recordNumber, identifier);
            return null;
        }
        Integer year = parseYear(row.get("year"));
        if (year == null) {
            log.warn("Record {} ({}): missing or invalid year '{}', dropped", recordNumber, identifier,
                    row.get("year"));
            return null;
        }
        String doi = row.get("doi");
        if (doi != null) doi = StringUtils.trimToNull(DOI_PREFIX.matcher(doi).replaceFirst(""));

        var urls = new LinkedHashSet<Url>();
        for (String column : URL_COLUMNS) {
            String value = row.get(column);
            if (value == null) continue;
            for (String token : URL_SEPARATOR.split(value)) {
                Url url = Url.orNull(token);
                if (url != null) urls.add(url.withoutFragment());
            }
        }
        if (doi != null && config.doiResolver() != null) {
            urls.add(new Url(config.doiResolver() + doi));
        }
        String bibcode = row.get("bibcode");
        if (bibcode != null) {
            for (String hint : config.bibcodeUrls(bibcode)) {
                Url url = Url.orNull(hint);
                if (url != null) urls.add(url);
            }
        }
        return new Candidate(identifier, title, year, doi, new ArrayList<>(urls));
    }

    static @Nullable Integer parseYear(@Nullable String value) {
        if (value == null) return null;
        Matcher matcher = YEAR_PATTERN.matcher(value);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    private static @Nullable String first(Map<String, String> row, List<String> columns) {
        for (String column : columns) {
            String value = row.get(column);
            if (value != null) return value;
        }
        return null;
    }
}
