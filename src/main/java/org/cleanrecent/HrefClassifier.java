package org.cleanrecent;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Decodes the {@code href} of a bookmark and decides whether it points at a local file under one of the removal
 * prefixes.
 * <p>
 * Recognised schemes: {@code file://} (local) and {@code trash://}, {@code mtp://}, {@code ftp://}, {@code sftp://}
 * (never removed). Any other scheme means the manifest holds something this filter does not understand, which
 * fails the whole run.
 */
public final class HrefClassifier {

    static final String HREF = "href";
    static final String FILE_SCHEME = "file://";
    static final List<String> NON_LOCAL_SCHEMES = List.of("trash://", "mtp://", "ftp://", "sftp://");

    private final PathPrefixSet prefixes;

    public HrefClassifier(PathPrefixSet prefixes) {
        this.prefixes = Objects.requireNonNull(prefixes, "prefixes must not be null");
    }

    /**
     * Classifies the bookmark carrying {@code attributes}.
     *
     * @throws MissingOrAmbiguousHrefException if there is not exactly one {@code href}
     * @throws UnrecognizedSchemeException     if the decoded href has an unknown scheme
     */
    public Href classify(List<XmlEvent.Attribute> attributes) throws BookmarkFilterException {
        String href = decode(hrefValue(attributes));
        if (href.startsWith(FILE_SCHEME)) {
            return Href.local(href, href.substring(FILE_SCHEME.length()));
        }
        for (String scheme : NON_LOCAL_SCHEMES) {
            if (href.startsWith(scheme)) return Href.nonLocal(href);
        }
        throw new UnrecognizedSchemeException(href);
    }

    /** True if the bookmark is local and its path falls under a removal prefix. */
    public boolean shouldRemove(Href href) {
        return href.isLocal() && prefixes.matches(href.path());
    }

    static byte[] hrefValue(List<XmlEvent.Attribute> attributes) throws MissingOrAmbiguousHrefException {
        byte[] value = null;
        int count = 0;
        for (XmlEvent.Attribute a : attributes) {
            if (a.isNamed(HREF)) {
                value = a.value();
                count++;
            }
        }
        if (count != 1) throw new MissingOrAmbiguousHrefException(count);
        return value;
    }

    /** Percent-decodes the raw bytes and turns them into text, replacing invalid UTF-8 with U+FFFD. */
    static String decode(byte[] raw) {
        return new String(percentDecode(raw), StandardCharsets.UTF_8);
    }

    /** {@code %XY} becomes one byte; a {@code %} not followed by two hex digits is kept as is. */
    static byte[] percentDecode(byte[] raw) {
        byte[] out = new byte[raw.length];
        int write = 0;
        int i = 0;
        while (i < raw.length) {
            byte b = raw[i];
            if (b == '%' && i + 2 < raw.length) {
                int hi = hexValue(raw[i + 1]);
                int lo = hexValue(raw[i + 2]);
                if (hi >= 0 && lo >= 0) {
                    out[write++] = (byte) ((hi << 4) | lo);
                    i += 3;
                    continue;
                }
            }
            out[write++] = b;
            i++;
        }
        if (write == out.length) return out;
        byte[] trimmed = new byte[write];
        System.arraycopy(out, 0, trimmed, 0, write);
        return trimmed;
    }

    private static int hexValue(byte b) {
        if (b >= '0' && b <= '9') return b - '0';
        if (b >= 'A' && b <= 'F') return b - 'A' + 10;
        if (b >= 'a' && b <= 'f') return b - 'a' + 10;
        return -1;
    }
}
