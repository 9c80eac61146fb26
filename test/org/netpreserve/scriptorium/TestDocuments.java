package org.netpreserve.scriptorium;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

class TestDocuments {
    static final String TEXT = "On the electrodynamics of moving bodies. It is known that Maxwell's " +
                               "electrodynamics, as usually understood at the present time, when applied to moving " +
                               "bodies, leads to asymmetries which do not appear to be inherent in the phenomena.";

    /**
     * A PDF whose every page carries {@code text}, or no text at all when it is null.
     */
    static byte[] pdf(int pages, String text) {
        try (var document = new PDDocument(); var out = new ByteArrayOutputStream()) {
            for (int i = 0; i < pages; i++) {
                var page = new PDPage();
                document.addPage(page);
                try (var stream = new PDPageContentStream(document, page)) {
                    if (text != null) {
                        stream.beginText();
                        stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 10);
                        stream.newLineAtOffset(40, 700);
                        for (String line : wrap(text, 80)) {
                            stream.showText(line);
                            stream.newLineAtOffset(0, -14);
                        }
                        stream.endText();
                    } else {
                        stream.addRect(40, 40, 200, 200);
                        stream.fill();
                    }
                }
            }
            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<String> wrap(String text, int width) {
        var lines = new ArrayList<String>();
        var line = new StringBuilder();
        for (String word : text.split(" ")) {
            if (line.length() > 0 && line.length() + word.length() + 1 > width) {
                lines.add(line.toString());
                line.setLength(0);
            }
            if (line.length() > 0) line.append(' ');
            line.append(word);
        }
        if (line.length() > 0) lines.add(line.toString());
        return lines;
    }

    static byte[] textPdf() {
        return pdf(2, TEXT);
    }

    /**
     * PNG signature followed by filler, enough to be sniffed and pass the size check.
     */
    static byte[] png() {
        byte[] data = new byte[512];
        byte[] magic = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n'};
        System.arraycopy(magic, 0, data, 0, magic.length);
        return data;
    }

    static byte[] djvu() {
        byte[] data = new byte[512];
        byte[] magic = "AT&TFORM".getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(magic, 0, data, 0, magic.length);
        return data;
    }

    static byte[] html() {
        return ("<!DOCTYPE html><html><head><title>Login</title></head><body>" + "x".repeat(500) +
                "</body></html>").getBytes(StandardCharsets.UTF_8);
    }
}
