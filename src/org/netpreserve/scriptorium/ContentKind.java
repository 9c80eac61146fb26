package org.netpreserve.scriptorium;

import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Payload formats recognised by their leading bytes.
 */
public enum ContentKind {
    PDF("pdf", "application/pdf", false),
    DJVU("djvu", "image/vnd.djvu", true),
    TIFF("tif", "image/tiff", true),
    PNG("png", "image/png", true),
    JPEG("jpg", "image/jpeg", true),
    HTML("html", "text/html", false),
    UNKNOWN("bin", "application/octet-stream", false);

    private static final int SNIFF_WINDOW = 1024;
    private static final List<String> HTML_MARKERS = List.of("<!doctype html", "<html", "<head", "<body");

    private final String extension;
    private final String mediaType;
    private final boolean imageScan;

    ContentKind(String extension, String mediaType, boolean imageScan) {
        this.extension = extension;
        this.mediaType = mediaType;
        this.imageScan = imageScan;
    }

    public String extension() {
        return extension;
    }

    public String mediaType() {
        return mediaType;
    }

    /**
     * True for raster formats, which never carry a text layer.
     */
    public boolean isImageScan() {
        return imageScan;
    }

    public static ContentKind sniff(byte[] data) {
        if (startsWith(data, 0, "AT&TFORM")) return DJVU;
        if (startsWith(data, 0, "II*\0") || startsWith(data, 0, "MM\0*")) return TIFF;
        if (data.length >= 4 && (data[0] & 0xff) == 0x89 && startsWith(data, 1, "PNG")) return PNG;
        if (data.length >= 3 && (data[0] & 0xff) == 0xff && (data[1] & 0xff) == 0xd8 && (data[2] & 0xff) == 0xff) {
            return JPEG;
        }
        // PDF readers tolerate junk before the header, so look a little further in, but a page that merely
        // mentions the header after its own markup is still a page
        String head = new String(data, 0, Math.min(data.length, SNIFF_WINDOW), StandardCharsets.ISO_8859_1);
        int pdf = head.indexOf("%PDF-");
        int html = firstHtmlMarker(head.toLowerCase(Locale.ROOT));
        if (pdf >= 0 && (html < 0 || pdf < html)) return PDF;
        if (html >= 0) return HTML;
        return UNKNOWN;
    }

    /**
     * Maps a Content-Type header to a kind, ignoring parameters.
     */
    public static ContentKind fromMediaType(@Nullable String contentType) {
        if (contentType == null) return UNKNOWN;
        String base = contentType.split(";", 2)[0].strip().toLowerCase(Locale.ROOT);
        return switch (base) {
            case "application/pdf", "application/x-pdf" -> PDF;
            case "image/vnd.djvu", "image/x-djvu" -> DJVU;
            case "image/tiff" -> TIFF;
            case "image/png" -> PNG;
            case "image/jpeg" -> JPEG;
            case "text/html", "application/xhtml+xml" -> HTML;
            default -> UNKNOWN;
        };
    }

    private static int firstHtmlMarker(String lower) {
        int first = -1;
        for (String marker : HTML_MARKERS) {
            int i = lower.indexOf(marker);
            if (i >= 0 && (first < 0 || i < first)) first = i;
        }
        return first;
    }

    private static boolean startsWith(byte[] data, int offset, String magic) {
        if (data.length < offset + magic.length()) return false;
        for (int i = 0; i < magic.length(); i++) {
            if (data[offset + i] != (byte) magic.charAt(i)) return false;
        }
        return true;
    }
}
