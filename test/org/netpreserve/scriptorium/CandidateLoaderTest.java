package org.netpreserve.scriptorium;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.scriptorium.config.SourceConfig;
import org.netpreserve.scriptorium.util.Url;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandidateLoaderTest {
    @TempDir
    Path dir;

    private final CandidateLoader loader = new CandidateLoader(new SourceConfig(",", null, List.of()));

    @Test
    public void readsCsv() throws Exception {
        Path csv = dir.resolve("candidates.csv");
        Files.writeString(csv, """
                bibcode,title,year,doi,url_hint
                1905AnP...322..891E,On the Electrodynamics of Moving Bodies,1905,doi:10.1002/andp.19053221004,https://trusted.example/a.pdf
                1916AnP...354..769E,The Foundation of the General Theory of Relativity,1916-03,,https://trusted.example/b.pdf|https://mirror.example/b.pdf#page=2
                """);
        List<Candidate> candidates = loader.load(csv);
        assertEquals(2, candidates.size());

        var first = candidates.get(0);
        assertEquals("1905AnP...322..891E", first.identifier());
        assertEquals(1905, first.year());
        assertEquals("10.1002/andp.19053221004", first.doi());
        assertEquals(List.of(new Url("https://trusted.example/a.pdf")), first.urls());

        var second = candidates.get(1);
        assertEquals(1916, second.year());
        assertNull(second.doi());
        assertEquals(List.of(new Url("https://trusted.example/b.pdf"), new Url("https://mirror.example/b.pdf")),
                second.urls());
    }

    @Test
    public void readsJsonLines() throws Exception {
        Path jsonl = dir.resolve("candidates.jsonl");
        Files.writeString(jsonl, """
                {"identifier": "A", "title": "Alpha", "year": 2001, "urls": "https://trusted.example/a.pdf https://trusted.example/a.pdf"}
                {"identifier": "B", "title": "Beta", "year": "2002", "url": "https://mirror.example/b.pdf"}
                """);
        var candidates = loader.load(jsonl);
        assertEquals(List.of("A", "B"), candidates.stream().map(Candidate::identifier).toList());
        assertEquals(1, candidates.get(0).urls().size(), "duplicate hints collapse");
        assertEquals(2002, candidates.get(1).year());
    }

    @Test
    public void dropsIncompleteRecordsAndDuplicates() throws Exception {
        Path csv = dir.resolve("candidates.csv");
        Files.writeString(csv, """
                identifier,title,year,url
                A,Alpha,2001,https://trusted.example/a.pdf
                ,No identifier,2001,https://trusted.example/x.pdf
                C,,2003,https://trusted.example/c.pdf
                D,Delta,nan,https://trusted.example/d.pdf
                E,Epsilon,unknown,https://trusted.example/e.pdf
                A,Alpha again,2004,https://trusted.example/a2.pdf
                F,Phi,2006,
                """);
        var candidates = loader.load(csv);
        assertEquals(List.of("A", "F"), candidates.stream().map(Candidate::identifier).toList());
        assertEquals("Alpha", candidates.get(0).title());
        assertTrue(candidates.get(1).urls().isEmpty());
    }

    @Test
    public void doiResolverIsTheLastHint() throws Exception {
        var resolving = new CandidateLoader(new SourceConfig(";", "https://doi.org/", List.of()));
        Path csv = dir.resolve("candidates.txt");
        Files.writeString(csv, """
                ID;Title;Year;DOI;URL_HINT
                X;Some title;1999;https://doi.org/10.1000/XYZ;https://trusted.example/x.pdf
                """);
        var candidate = resolving.load(csv).get(0);
        assertEquals("10.1000/XYZ", candidate.doi());
        assertEquals(List.of(new Url("https://trusted.example/x.pdf"), new Url("https://doi.org/10.1000/XYZ")),
                candidate.urls());
    }

    @Test
    public void bibcodeOnlyRecordsGetAdsHints() throws Exception {
        var ads = new CandidateLoader(new SourceConfig(",", "https://doi.org/",
                List.of(SourceConfig.ADS_GATEWAY, "http://adsabs.harvard.edu/pdf/{bibcode}")));
        Path csv = dir.resolve("ads.csv");
        Files.writeString(csv, """
                bibcode,title,year,doi,url_hint
                1905AnP...322..891E,Zur Elektrodynamik bewegter Körper,1905,,
                1916AnP...354..769E,Die Grundlage der allgemeinen Relativitätstheorie,1916,10.1002/andp.19163540702,https://archive.org/grundlage.pdf
                """);
        var candidates = ads.load(csv);
        assertEquals(List.of(new Url("https://ui.adsabs.harvard.edu/link_gateway/1905AnP...322..891E/PUB_PDF"),
                new Url("http://adsabs.harvard.edu/pdf/1905AnP...322..891E")), candidates.get(0).urls());
        assertEquals(List.of(new Url("https://archive.org/grundlage.pdf"),
                new Url("https://doi.org/10.1002/andp.19163540702"),
                new Url("https://ui.adsabs.harvard.edu/link_gateway/1916AnP...354..769E/PUB_PDF"),
                new Url("http://adsabs.harvard.edu/pdf/1916AnP...354..769E")), candidates.get(1).urls());
    }

    @Test
    public void loadingIsDeterministic() throws Exception {
        Path csv = dir.resolve("candidates.csv");
        Files.writeString(csv, """
                identifier,title,year,url_hint
                B,Beta,2002,https://mirror.example/b.pdf;https://trusted.example/b.pdf
                A,Alpha,2001,https://trusted.example/a.pdf
                """);
        assertEquals(loader.load(csv), loader.load(csv));
        assertEquals("B", loader.load(csv).get(0).identifier());
    }

    @Test
    public void unreadableSourceIsAConfigurationError() {
        var e = assertThrows(ConfigurationException.class, () -> loader.load(dir.resolve("missing.csv")));
        assertEquals("configuration", e.errorClass());
    }

    @Test
    public void parseYear() {
        assertEquals(1905, CandidateLoader.parseYear("1905"));
        assertEquals(1905, CandidateLoader.parseYear(" 1905-06-30"));
        assertNull(CandidateLoader.parseYear("c. 1905"));
        assertNull(CandidateLoader.parseYear(null));
    }
}
