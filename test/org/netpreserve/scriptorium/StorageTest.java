package org.netpreserve.scriptorium;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.jwarc.WarcReader;
import org.netpreserve.jwarc.WarcRecord;
import org.netpreserve.jwarc.WarcRequest;
import org.netpreserve.jwarc.WarcResponse;
import org.netpreserve.scriptorium.config.StorageConfig;
import org.netpreserve.scriptorium.util.Url;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class StorageTest {
    private final ContentVerifier verifier = new ContentVerifier(TestConfigs.verify(), false);

    private static Download download(String url, byte[] body) {
        return ScriptedDownloader.response(new Url(url), 200, "application/pdf", body,
                Map.of("transfer-encoding", List.of("chunked")));
    }

    @Test
    public void storesByChecksumAndDeduplicates(@TempDir Path dir) throws Exception {
        byte[] pdf = TestDocuments.textPdf();
        var content = verifier.verify(pdf, "application/pdf");
        try (var storage = new Storage(dir, new StorageConfig(false, "test", true), 1)) {
            String path = storage.store(content, download("https://trusted.example/a.pdf", pdf));
            assertEquals("documents/" + content.checksum().substring(0, 2) + "/" + content.checksum() + ".pdf", path);
            assertArrayEquals(pdf, Files.readAllBytes(dir.resolve(path)));

            String again = storage.store(content, download("https://mirror.example/a.pdf", pdf));
            assertEquals(path, again);
        }
        try (Stream<Path> files = Files.walk(dir.resolve("documents"))) {
            List<Path> regular = files.filter(Files::isRegularFile).toList();
            assertEquals(1, regular.size(), "one copy and no temporary files: " + regular);
        }
        assertFalse(Files.exists(dir.resolve("warcs")));
    }

    @Test
    public void quarantinesRejectedPayloads(@TempDir Path dir) throws Exception {
        byte[] html = TestDocuments.html();
        try (var storage = new Storage(dir, new StorageConfig(false, "test", true), 1)) {
            storage.quarantine(html, "ff".repeat(32), ContentKind.HTML);
            storage.quarantine(new byte[0], "00".repeat(32), null);
        }
        assertArrayEquals(html, Files.readAllBytes(dir.resolve("quarantine").resolve("ff".repeat(32) + ".html")));
        assertFalse(Files.exists(dir.resolve("quarantine").resolve("00".repeat(32) + ".bin")));

        Path other = dir.resolve("other");
        try (var storage = new Storage(other, new StorageConfig(false, "test", false), 1)) {
            storage.quarantine(html, "ff".repeat(32), ContentKind.HTML);
        }
        assertFalse(Files.exists(other.resolve("quarantine")));
    }

    @Test
    public void recordsExchangesAsWarc(@TempDir Path dir) throws Exception {
        byte[] pdf = TestDocuments.textPdf();
        var content = verifier.verify(pdf, "application/pdf");
        try (var storage = new Storage(dir, new StorageConfig(true, "test", true), 2)) {
            storage.store(content, download("https://trusted.example/a.pdf?download=1", pdf));
        }

        List<Path> warcs;
        try (Stream<Path> files = Files.list(dir.resolve("warcs"))) {
            warcs = files.toList();
        }
        assertEquals(1, warcs.size());
        assertTrue(warcs.get(0).getFileName().toString().startsWith("test-"));

        var records = new ArrayList<WarcRecord>();
        byte[] payload = null;
        try (var reader = new WarcReader(warcs.get(0))) {
            for (WarcRecord record : reader) {
                records.add(record);
                if (record instanceof WarcResponse response) {
                    assertEquals("https://trusted.example/a.pdf?download=1", response.target());
                    assertEquals(200, response.http().status());
                    assertFalse(response.http().headers().first("Transfer-Encoding").isPresent());
                    assertTrue(response.payloadDigest().isPresent());
                    payload = response.http().body().stream().readAllBytes();
                } else if (record instanceof WarcRequest request) {
                    assertEquals("/a.pdf?download=1", request.http().target());
                }
            }
        }
        assertEquals(List.of("warcinfo", "response", "request"), records.stream().map(WarcRecord::type).toList());
        assertArrayEquals(pdf, payload);
    }
}
