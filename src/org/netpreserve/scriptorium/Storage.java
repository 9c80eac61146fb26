package org.netpreserve.scriptorium;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.jwarc.*;
import org.netpreserve.scriptorium.config.StorageConfig;
import org.netpreserve.scriptorium.util.Checksums;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.*;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;
import static org.netpreserve.jwarc.MediaType.HTTP_REQUEST;
import static org.netpreserve.jwarc.MediaType.HTTP_RESPONSE;

/**
 * Content-addressed document store under the data directory:
 * <pre>
 * documents/ab/ab12...ef.pdf   verified payloads, named by SHA-256
 * quarantine/cd34...01.bin     payloads that failed verification
 * warcs/                       optional WARC capture of each archived exchange
 * </pre>
 * Files are written to a temporary name and atomically moved into place, so a crash never leaves a truncated
 * document under its final name.
 */
public class Storage implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Storage.class);
    private static final long WARC_ROTATE_SIZE = 1024L * 1024 * 1024;
    private static final Set<String> UNRECORDABLE_HEADERS = Set.of("transfer-encoding");
    private final Path directory;
    private final StorageConfig config;
    private final @Nullable BlockingDeque<WarcRotator> warcPool;
    private final int poolSize;
    private final TimeBasedEpochGenerator uuidGenerator = Generators.timeBasedEpochGenerator();

    public Storage(Path directory, StorageConfig config, int poolSize) throws IOException {
        this.directory = directory;
        this.config = config;
        this.poolSize = poolSize;
        Files.createDirectories(directory.resolve("documents"));
        if (config.warc()) {
            Path warcsDir = directory.resolve("warcs");
            Files.createDirectories(warcsDir);
            String prefix = config.prefix() == null ? "scriptorium" : config.prefix();
            warcPool = new LinkedBlockingDeque<>(poolSize);
            for (int i = 0; i < poolSize; i++) {
                warcPool.add(new WarcRotator(warcsDir, prefix, WARC_ROTATE_SIZE));
            }
        } else {
            warcPool = null;
        }
    }

    /**
     * Stores a verified payload, reusing an existing copy with the same checksum.
     *
     * @return the document's path relative to the data directory, always with '/' separators
     */
    public String store(VerifiedContent content, Download download) throws IOException {
        String checksum = content.checksum();
        String relative = "documents/" + checksum.substring(0, 2) + "/" + checksum + "." + content.kind().extension();
        Path target = directory.resolve(relative);
        if (Files.exists(target) && Files.size(target) == content.size()) {
            log.debug("Already have {}", relative);
        } else {
            writeAtomically(target, content.payload());
            log.atInfo().addKeyValue("path", relative).addKeyValue("size", content.size()).log("Stored document");
        }
        if (warcPool != null) {
            saveWarc(download, content.payload());
        }
        return relative;
    }

    /**
     * Keeps a rejected payload for later inspection, when quarantine is enabled.
     */
    public void quarantine(byte[] payload, String checksum, @Nullable ContentKind kind) throws IOException {
        if (!config.quarantine() || payload.length == 0) return;
        String extension = kind == null ? ContentKind.UNKNOWN.extension() : kind.extension();
        Path target = directory.resolve("quarantine").resolve(checksum + "." + extension);
        if (Files.exists(target)) return;
        writeAtomically(target, payload);
        log.debug("Quarantined {}", target);
    }

    private static void writeAtomically(Path target, byte[] data) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".incoming-", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void saveWarc(Download download, byte[] payload) throws IOException {
        String target;
        try {
            URI uri = download.url().toURI();
            target = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            if (uri.getRawQuery() != null) target += "?" + uri.getRawQuery();
        } catch (URISyntaxException e) {
            throw new IOException("Unrecordable URL " + download.url(), e);
        }

        var httpResponse = new HttpResponse.Builder(download.status(), "")
                .addHeaders(recordableHeaders(download.headers()))
                .build();
        var httpRequest = new HttpRequest.Builder("GET", target)
                .addHeader("Host", download.url().host())
                .build();

        MessageDigest digest = Checksums.sha256();
        digest.update(payload);
        byte[] responseHeader = httpResponse.serializeHeader();
        UUID responseUuid = uuidGenerator.construct(download.date().toEpochMilli());
        var responseBuilder = new WarcResponse.Builder(download.url().toString())
                .date(download.date())
                .recordId(responseUuid)
                .body(HTTP_RESPONSE, Channels.newChannel(new SequenceInputStream(
                        new ByteArrayInputStream(responseHeader), new ByteArrayInputStream(payload))),
                        responseHeader.length + payload.length)
                .payloadDigest(new WarcDigest(digest));
        if (download.protocol() != null) responseBuilder.addHeader("WARC-Protocol", download.protocol());
        WarcResponse warcResponse = responseBuilder.build();

        WarcRequest warcRequest = new WarcRequest.Builder(download.url().toString())
                .date(download.date())
                .recordId(uuidGenerator.construct(download.date().toEpochMilli()))
                .concurrentTo(warcResponse.id())
                .body(HTTP_REQUEST, httpRequest.serializeHeader())
                .build();

        WarcRotator rotator;
        try {
            rotator = warcPool.takeFirst();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for a WARC writer");
        }
        try {
            String filename = rotator.write(List.of(warcResponse, warcRequest));
            log.debug("Wrote {} to {}", download.url(), filename);
        } finally {
            // back to the front of the pool to keep the number of open files low
            warcPool.addFirst(rotator);
        }
    }

    private static Map<String, List<String>> recordableHeaders(Map<String, List<String>> headers) {
        var map = new LinkedHashMap<String, List<String>>();
        headers.forEach((name, values) -> {
            if (UNRECORDABLE_HEADERS.contains(name)) return;
            map.put(name, values);
        });
        return map;
    }

    @Override
    public void close() throws IOException {
        if (warcPool == null) return;
        for (int i = 0; i < poolSize; i++) {
            try {
                warcPool.take().close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted closing WARC writers");
            }
        }
    }
}
