package org.netpreserve.scriptorium.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.netpreserve.scriptorium.ConfigurationException;
import org.netpreserve.scriptorium.config.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Finds candidates that are not yet in the master catalog and writes them as a source for the archiver.
 */
public class MissingFinder {
    private static final Logger log = LoggerFactory.getLogger(MissingFinder.class);
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {
    };
    private final CsvMapper csvMapper = new CsvMapper();
    private final String bibcodeHint;

    public MissingFinder() {
        this(SourceConfig.ADS_GATEWAY);
    }

    /**
     * @param bibcodeHint URL template used as the hint for candidates written without one
     */
    public MissingFinder(String bibcodeHint) {
        this.bibcodeHint = bibcodeHint;
    }

    /**
     * @return the number of missing candidates written
     */
    public int run(Path masterFile, Path candidatesFile, Path output) throws ConfigurationException, IOException {
        var master = new MasterCatalog(read(masterFile));
        List<CatalogEntry> candidates = dedupe(read(candidatesFile));
        List<CatalogEntry> missing = missing(candidates, master).stream()
                .map(entry -> entry.withBibcodeHint(bibcodeHint))
                .toList();
        write(missing, output);
        log.info("{} of {} candidates are missing from the master catalog ({} entries)", missing.size(),
                candidates.size(), master.size());
        return missing.size();
    }

    public List<CatalogEntry> missing(List<CatalogEntry> candidates, MasterCatalog master) {
        return candidates.stream().filter(candidate -> !master.contains(candidate)).toList();
    }

    /**
     * Keeps the first of any candidates sharing a bibcode or a DOI.
     */
    static List<CatalogEntry> dedupe(List<CatalogEntry> entries) {
        var seenBibcodes = new HashSet<String>();
        var seenDois = new HashSet<String>();
        var unique = new ArrayList<CatalogEntry>();
        for (CatalogEntry entry : entries) {
            String bibcode = entry.bibcode();
            String doi = entry.normalizedDoi();
            if (bibcode != null && seenBibcodes.contains(bibcode)) continue;
            if (doi != null && seenDois.contains(doi)) continue;
            if (bibcode != null) seenBibcodes.add(bibcode);
            if (doi != null) seenDois.add(doi);
            unique.add(entry);
        }
        return unique;
    }

    List<CatalogEntry> read(Path file) throws ConfigurationException {
        try (MappingIterator<Map<String, Object>> iterator = csvMapper.readerFor(ROW_TYPE)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(file.toFile())) {
            var entries = new ArrayList<CatalogEntry>();
            while (iterator.hasNext()) {
                entries.add(CatalogEntry.fromRow(iterator.next()));
            }
            return entries;
        } catch (IOException | RuntimeException e) {
            throw new ConfigurationException("Unable to read catalog " + file + ": " + e.getMessage(), e);
        }
    }

    void write(List<CatalogEntry> entries, Path output) throws IOException {
        if (output.getParent() != null) Files.createDirectories(output.getParent());
        CsvSchema schema = csvMapper.schemaFor(CatalogEntry.class).withHeader();
        try (Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
             SequenceWriter writer = csvMapper.writer(schema).writeValues(out)) {
            writer.writeAll(entries);
        }
    }
}
