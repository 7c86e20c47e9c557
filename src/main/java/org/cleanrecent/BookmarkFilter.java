package org.cleanrecent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass streaming filter for XBEL "recently used" manifests.
 * <p>
 * Features:
 * • Removes every {@code bookmark} element whose decoded {@code file://} location starts with one of the given
 *   prefixes, together with its subtree and the whitespace that followed it.
 * • Everything else is copied byte-for-byte: declaration, attribute order and quoting, entities, comments, EOLs.
 * • Never builds a tree; memory use is bounded by the largest single token.
 * • Thread-safe – all public methods are stateless.
 */
public final class BookmarkFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(BookmarkFilter.class);

    static final String BOOKMARK = "bookmark";

    private BookmarkFilter() {
    }

    /* ===================== Public Stream API ===================== */

    /**
     * Filters {@code in} into {@code out}. Neither stream is closed; {@code out} is flushed once at the end.
     *
     * @param in       manifest bytes
     * @param out      destination, must not be the file {@code in} reads from
     * @param prefixes path prefixes selecting bookmarks to remove
     * @return counts and removed hrefs
     * @throws BookmarkFilterException if the manifest cannot be filtered safely; output written so far is invalid
     * @throws IOException             if reading or writing fails
     */
    public static FilterResult filter(InputStream in, OutputStream out, List<String> prefixes) throws IOException {
        Objects.requireNonNull(in, "input stream must not be null");
        Objects.requireNonNull(out, "output stream must not be null");
        HrefClassifier classifier = new HrefClassifier(PathPrefixSet.of(prefixes));

        XmlEventReader reader = new XmlEventReader(in);
        OutputStream sink = out instanceof BufferedOutputStream || out instanceof ByteArrayOutputStream
                ? out : new BufferedOutputStream(out);
        FilterState state = new FilterState();
        List<String> removed = new ArrayList<>();
        int seen = 0;

        while (true) {
            XmlEvent event = reader.next();

            if (state.skipping) {
                if (event.isTag(XmlEvent.Kind.END_TAG, BOOKMARK)) {
                    state.skipping = false;
                    state.pendingWhitespaceSwallow = true;
                }
                continue;
            }

            switch (event.kind()) {
                case START_TAG:
                    if (BOOKMARK.equals(event.name())) {
                        seen++;
                        Href href = classifier.classify(event.attributes());
                        if (classifier.shouldRemove(href)) {
                            LOGGER.debug("removing bookmark {}", href.value());
                            removed.add(href.value());
                            state.skipping = true;
                            continue;
                        }
                    }
                    sink.write(event.raw());
                    break;
                case EMPTY_TAG:
                    if (BOOKMARK.equals(event.name())) seen++;
                    sink.write(event.raw());
                    break;
                case TEXT:
                    if (state.pendingWhitespaceSwallow) {
                        state.pendingWhitespaceSwallow = false;
                        String text = XmlEscapes.unescape(event.raw(), event.position());
                        if (!isBlank(text)) throw new StructuralAssumptionException(text, event.position());
                    } else {
                        sink.write(event.raw());
                    }
                    break;
                case END_OF_STREAM:
                    sink.flush();
                    return new FilterResult(seen, seen - removed.size(), removed);
                default:
                    sink.write(event.raw());
                    break;
            }
        }
    }

    /* ===================== Byte Array / File API ===================== */

    public static byte[] filter(byte[] bytes, List<String> prefixes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
        filter(new ByteArrayInputStream(bytes), out, prefixes);
        return out.toByteArray();
    }

    /**
     * Filters {@code input} into {@code output}, which is created or truncated. {@code input} itself is never
     * modified; replacing it with the result is the caller's business.
     */
    public static FilterResult filter(File input, File output, List<String> prefixes) throws IOException {
        if (input.getCanonicalFile().equals(output.getCanonicalFile()))
            throw new IllegalArgumentException("input and output must be different files: " + input);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(input.toPath()));
             OutputStream out = new BufferedOutputStream(Files.newOutputStream(output.toPath()))) {
            return filter(in, out, prefixes);
        }
    }

    /* ===================== Implementation helpers ===================== */

    /** Mutable state of one pass. */
    private static final class FilterState {
        boolean skipping;
        boolean pendingWhitespaceSwallow;
    }

    private static boolean isBlank(String text) {
        return text.codePoints().allMatch(BookmarkFilter::isWhiteSpace);
    }

    /** Unicode White_Space property. */
    static boolean isWhiteSpace(int cp) {
        return (cp >= 0x09 && cp <= 0x0D) || cp == 0x20 || cp == 0x85 || cp == 0xA0 || cp == 0x1680
                || (cp >= 0x2000 && cp <= 0x200A) || cp == 0x2028 || cp == 0x2029 || cp == 0x202F
                || cp == 0x205F || cp == 0x3000;
    }
}
