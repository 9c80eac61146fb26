package org.netpreserve.scriptorium;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.config.VerifyConfig;
import org.netpreserve.scriptorium.util.Checksums;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Checks that a payload is plausibly a document worth archiving. The checksum is computed before any check so
 * that rejected payloads can still be identified.
 */
public class ContentVerifier {
    private static final Logger log = LoggerFactory.getLogger(ContentVerifier.class);
    private final VerifyConfig config;
    private final boolean acceptScanOnly;

    public ContentVerifier(VerifyConfig config, boolean acceptScanOnly) {
        this.config = config;
        this.acceptScanOnly = acceptScanOnly;
    }

    /**
     * @param payload      raw response body
     * @param declaredType the Content-Type the server sent, if any. Only used for diagnostics: the bytes decide.
     */
    public VerifiedContent verify(byte[] payload, @Nullable String declaredType) throws VerificationException {
        String checksum = Checksums.sha256Hex(payload);
        long size = payload.length;
        if (size == 0) {
            throw new VerificationException("empty-payload", "Empty payload", checksum, 0, null);
        }
        if (size < config.minSize()) {
            throw new VerificationException("too-small", "Payload of " + size + " bytes is below the minimum of "
                                                         + config.minSize(), checksum, size, null);
        }

        ContentKind kind = ContentKind.sniff(payload);
        if (kind == ContentKind.UNKNOWN || kind == ContentKind.HTML) {
            throw new VerificationException("unsupported-kind", "Not a document (" + kind.mediaType()
                    + ", declared " + declaredType + ")", checksum, size, kind);
        }
        if (!config.accept().contains(kind)) {
            throw new VerificationException("kind-not-accepted", kind + " is not an accepted kind", checksum, size,
                    kind);
        }
        ContentKind declaredKind = ContentKind.fromMediaType(declaredType);
        if (declaredKind != ContentKind.UNKNOWN && declaredKind != kind) {
            log.debug("Server declared {} but content looks like {}", declaredType, kind);
        }

        Integer pages = null;
        TextStats textStats = null;
        if (kind == ContentKind.PDF) {
            var inspection = inspectPdf(payload);
            pages = inspection.pages();
            textStats = inspection.textStats();
        }

        if (pages != null && (pages < 1 || (config.maxPages() != null && pages > config.maxPages()))) {
            throw new VerificationException("page-count-out-of-range", "Document has " + pages + " pages",
                    checksum, size, kind);
        }

        boolean bareScan = kind.isImageScan() || (textStats != null && textStats.chars() < config.minTextChars());
        if (bareScan && !acceptScanOnly) {
            throw new VerificationException("scan-only-not-accepted", "Document has no usable text layer",
                    checksum, size, kind);
        }

        return new VerifiedContent(payload, checksum, kind, pages, textStats, bareScan);
    }

    /**
     * Best effort: a document PDFBox can't read gets an unknown page count and unknown statistics.
     */
    private PdfInspection inspectPdf(byte[] payload) {
        try (PDDocument document = Loader.loadPDF(payload)) {
            int pages = document.getNumberOfPages();
            TextStats textStats = null;
            int sample = Math.min(pages, config.textPages());
            if (sample > 0) {
                try {
                    var stripper = new PDFTextStripper();
                    stripper.setStartPage(1);
                    stripper.setEndPage(sample);
                    textStats = TextStats.of(stripper.getText(document), sample);
                } catch (IOException | RuntimeException e) {
                    log.debug("Text extraction failed", e);
                }
            }
            return new PdfInspection(pages, textStats);
        } catch (IOException | RuntimeException e) {
            log.debug("Unable to parse PDF", e);
            return new PdfInspection(null, null);
        }
    }

    private record PdfInspection(@Nullable Integer pages, @Nullable TextStats textStats) {
    }
}
