package org.netpreserve.scriptorium;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ScriptoriumTest {
    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Scriptorium.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void help() {
        assertEquals(Scriptorium.EXIT_OK, run("--help"));
        assertTrue(out().contains("Usage: scriptorium"));
    }

    @Test
    public void badArgumentsAreConfigurationErrors() {
        assertEquals(Scriptorium.EXIT_CONFIG_ERROR, run("--frobnicate"));
        assertTrue(err().contains("Unknown option: --frobnicate"));
        assertEquals(Scriptorium.EXIT_CONFIG_ERROR, run("--workers", "many", "a.csv"));
        assertEquals(Scriptorium.EXIT_CONFIG_ERROR, run("a.csv", "--data-dir"));
        assertEquals(Scriptorium.EXIT_CONFIG_ERROR, run("a.csv", "b.csv"));
        assertEquals(Scriptorium.EXIT_CONFIG_ERROR, run("-d", dir.toString()));
        assertEquals(Scriptorium.EXIT_CONFIG_ERROR, run("-c", dir.resolve("missing.yaml").toString(), "a.csv"));
    }

    @Test
    public void unreadableSourceExitsWithTwo() {
        assertEquals(Scriptorium.EXIT_CONFIG_ERROR,
                run("-d", dir.resolve("data").toString(), dir.resolve("missing.csv").toString()));
    }

    @Test
    public void dumpConfigAppliesOverrides() {
        assertEquals(Scriptorium.EXIT_OK, run("-d", dir.toString(), "--dump-config", "--workers", "7",
                "--trust-host", "new.example", "--accept-scan-only", "--no-warc"));
        String yaml = out();
        assertTrue(yaml.contains("workers: 7"), yaml);
        assertTrue(yaml.contains("acceptScanOnly: true"), yaml);
        assertTrue(yaml.contains("host: \"new.example\""), yaml);
        assertTrue(yaml.contains("host: \"archive.org\""), "command line hosts are added to the configured ones");
        assertTrue(yaml.contains("warc: false"), yaml);
    }

    @Test
    public void configFileInDataDirIsPickedUp() throws Exception {
        Files.writeString(dir.resolve("config.yaml"), "fetch:\n  retries: 9\n");
        assertEquals(Scriptorium.EXIT_OK, run("-d", dir.toString(), "--dump-config"));
        assertTrue(out().contains("retries: 9"), out());
    }

    @Test
    public void runWithNothingTrustedMakesNoRequests() throws Exception {
        Path source = dir.resolve("candidates.csv");
        Files.writeString(source, """
                identifier,title,year,url_hint
                A,Paper A,2001,https://untrusted.example/a.pdf
                B,Paper B,2002,
                """);
        Path data = dir.resolve("data");
        assertEquals(Scriptorium.EXIT_OK, run("archive", "-d", data.toString(), "--no-warc", source.toString()));
        assertTrue(out().contains("Run complete"), out());
        assertTrue(Files.exists(data.resolve("ledger.sqlite3")));
        assertEquals(3, Files.readAllLines(data.resolve("ledger.csv")).size());
    }

    @Test
    public void missingCommand() throws Exception {
        Path master = dir.resolve("master.csv");
        Files.writeString(master, "title,year,bibcode\nKnown,1999,K1\n");
        Path candidates = dir.resolve("candidates.csv");
        Files.writeString(candidates, "title,year,bibcode\nKnown,1999,K1\nUnknown,2001,U1\n");
        Path output = dir.resolve("missing.csv");

        assertEquals(Scriptorium.EXIT_OK, run("missing", "--master", master.toString(), "--candidates",
                candidates.toString(), "--out", output.toString()));
        assertTrue(out().contains("Missing vs master: 1"), out());
        assertEquals(Scriptorium.EXIT_CONFIG_ERROR, run("missing", "--master", master.toString()));
    }
}
