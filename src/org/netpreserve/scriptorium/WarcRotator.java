package org.netpreserve.scriptorium;

import org.netpreserve.jwarc.WarcCompression;
import org.netpreserve.jwarc.WarcRecord;
import org.netpreserve.jwarc.WarcWriter;
import org.netpreserve.jwarc.Warcinfo;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

import static java.nio.file.StandardOpenOption.*;

/**
 * A gzipped WARC file that is closed once it grows past a size limit, the next write opening a fresh file.
 * Not thread-safe: {@link Storage} hands each rotator to one thread at a time.
 */
public class WarcRotator implements Closeable {
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);
    private static final String ALPHABET = "ABCDFGHJKLMNPQRSTVWXYZabcdfghjklmnpqrstvwxyz0123456789";
    private final SecureRandom random = new SecureRandom();
    private final Path directory;
    private final String prefix;
    private final long rotateAt;
    private WarcWriter warcWriter;
    private String filename;

    public WarcRotator(Path directory, String prefix, long rotateAt) {
        this.directory = directory;
        this.prefix = prefix;
        this.rotateAt = rotateAt;
    }

    /**
     * Writes the records contiguously to the current file.
     *
     * @return the name of the file they were written to
     */
    public String write(List<? extends WarcRecord> records) throws IOException {
        if (warcWriter == null) open();
        String writtenTo = filename;
        for (WarcRecord record : records) {
            warcWriter.write(record);
        }
        if (warcWriter.position() > rotateAt) close();
        return writtenTo;
    }

    private void open() throws IOException {
        filename = prefix + "-" + DATE_FORMAT.format(Instant.now()) + "-" + randomId() + ".warc.gz";
        warcWriter = new WarcWriter(FileChannel.open(directory.resolve(filename), WRITE, CREATE_NEW),
                WarcCompression.GZIP);
        warcWriter.write(new Warcinfo.Builder()
                .filename(filename)
                .fields(Map.of("software", List.of("scriptorium"),
                        "format", List.of("WARC File Format 1.0"),
                        "description", List.of("Archived scholarly documents")))
                .build());
    }

    private String randomId() {
        var sb = new StringBuilder();
        for (int i = 0; i < 5; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    @Override
    public void close() throws IOException {
        if (warcWriter != null) {
            warcWriter.close();
            warcWriter = null;
        }
    }
}
