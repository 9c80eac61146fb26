package org.netpreserve.scriptorium.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Writes the ledger out as {@code ledger.csv} and {@code ledger.jsonl}, one line per entry. Exports are
 * regenerated from the database, which stays the record of truth.
 */
public class LedgerExporter {
    private static final Logger log = LoggerFactory.getLogger(LedgerExporter.class);
    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper jsonMapper = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public void export(List<LedgerRow> rows, Path directory) throws IOException {
        List<Line> lines = rows.stream().map(Line::of).toList();
        CsvSchema schema = csvMapper.schemaFor(Line.class).withHeader();
        writeAtomically(directory.resolve("ledger.csv"), out -> {
            try (SequenceWriter writer = csvMapper.writer(schema).writeValues(out)) {
                writer.writeAll(lines);
            }
        });
        writeAtomically(directory.resolve("ledger.jsonl"), out -> {
            for (Line line : lines) {
                out.write(jsonMapper.writeValueAsString(line));
                out.write('\n');
            }
        });
        log.info("Exported {} ledger entries to {}", lines.size(), directory);
    }

    private static void writeAtomically(Path target, WriterAction action) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            action.write(out);
        }
        Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING);
    }

    @FunctionalInterface
    private interface WriterAction {
        void write(Writer out) throws IOException;
    }

    @JsonPropertyOrder({"seq", "run", "kind", "identifier", "url", "host", "date", "outcome", "status", "error",
            "elapsedMs", "retries", "checksum", "size", "path", "pages", "textChars", "textWords"})
    record Line(long seq,
                long run,
                LedgerRow.Kind kind,
                String identifier,
                @Nullable String url,
                @Nullable String host,
                String date,
                Outcome outcome,
                @Nullable Integer status,
                @Nullable String error,
                @Nullable Long elapsedMs,
                @Nullable Integer retries,
                @Nullable String checksum,
                @Nullable Long size,
                @Nullable String path,
                @Nullable Integer pages,
                @Nullable Integer textChars,
                @Nullable Integer textWords) {
        static Line of(LedgerRow row) {
            return new Line(row.seq(), row.runId(), row.kind(), row.identifier(),
                    row.url() == null ? null : row.url().toString(), row.host(), row.date().toString(), row.outcome(),
                    row.status(), row.error(), row.elapsedMs(), row.retries(), row.checksum(), row.size(),
                    row.path(), row.pages(), row.textChars(), row.textWords());
        }
    }
}
