package org.cleanrecent;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One lexical unit of an XML byte stream.
 * <p>
 * Every event keeps the exact bytes it was read from, so writing {@link #raw()} back reproduces the input verbatim.
 * Tag names are decoded eagerly; attributes are parsed on demand and stay raw bytes.
 */
public final class XmlEvent {

    public enum Kind {
        START_TAG,
        END_TAG,
        EMPTY_TAG,
        TEXT,
        DECLARATION,
        COMMENT,
        CDATA,
        PROCESSING_INSTRUCTION,
        DOCTYPE,
        END_OF_STREAM
    }

    /** Attribute as written in the tag: undecoded key and value bytes (value without its quotes). */
    public record Attribute(byte[] key, byte[] value) {

        public boolean isNamed(String name) {
            return Arrays.equals(key, name.getBytes(StandardCharsets.UTF_8));
        }

        public String keyAsString() {
            return new String(key, StandardCharsets.UTF_8);
        }

        @Override
        public String toString() {
            return keyAsString() + "=" + new String(value, StandardCharsets.UTF_8);
        }
    }

    private static final byte[] NO_BYTES = new byte[0];

    private final Kind kind;
    private final byte[] raw;
    private final String name;
    private final long position;

    private XmlEvent(Kind kind, byte[] raw, String name, long position) {
        this.kind = kind;
        this.raw = raw;
        this.name = name;
        this.position = position;
    }

    static XmlEvent tag(Kind kind, byte[] raw, String name, long position) {
        return new XmlEvent(kind, raw, name, position);
    }

    static XmlEvent of(Kind kind, byte[] raw, long position) {
        return new XmlEvent(kind, raw, null, position);
    }

    static XmlEvent endOfStream(long position) {
        return new XmlEvent(Kind.END_OF_STREAM, NO_BYTES, null, position);
    }

    public Kind kind() {
        return kind;
    }

    /** Exact input bytes of this event; not copied, callers must not modify. */
    public byte[] raw() {
        return raw;
    }

    /** Element name for tag events, {@code null} otherwise. */
    public String name() {
        return name;
    }

    public long position() {
        return position;
    }

    public boolean isTag(Kind tagKind, String tagName) {
        return kind == tagKind && tagName.equals(name);
    }

    /**
     * Parses the attributes of a start or empty tag in document order.
     *
     * @return attribute list, empty for tags without attributes and for non-tag events
     * @throws MalformedXmlException if an attribute is not of the form {@code key="value"} or {@code key='value'}
     */
    public List<Attribute> attributes() throws MalformedXmlException {
        if (kind != Kind.START_TAG && kind != Kind.EMPTY_TAG) return Collections.emptyList();

        int end = raw.length - (kind == Kind.EMPTY_TAG ? 2 : 1);
        int pos = 1;
        while (pos < end && !isWs(raw[pos])) pos++;
        List<Attribute> attrs = new ArrayList<>();
        while (true) {
            pos = skipWs(pos, end);
            if (pos >= end) break;

            int keyStart = pos;
            while (pos < end && !isWs(raw[pos]) && raw[pos] != '=') pos++;
            byte[] key = Arrays.copyOfRange(raw, keyStart, pos);

            pos = skipWs(pos, end);
            if (pos >= end || raw[pos] != '=')
                throw new MalformedXmlException("attribute without value in <" + name + ">", position + keyStart);
            pos = skipWs(pos + 1, end);
            if (pos >= end || (raw[pos] != '"' && raw[pos] != '\''))
                throw new MalformedXmlException("unquoted attribute value in <" + name + ">", position + pos);

            byte quote = raw[pos++];
            int valStart = pos;
            while (pos < end && raw[pos] != quote) pos++;
            if (pos >= end)
                throw new MalformedXmlException("unterminated attribute value in <" + name + ">", position + valStart);
            attrs.add(new Attribute(key, Arrays.copyOfRange(raw, valStart, pos)));
            pos++;
        }
        return attrs;
    }

    private int skipWs(int pos, int end) {
        while (pos < end && isWs(raw[pos])) pos++;
        return pos;
    }

    static boolean isWs(int b) {
        return b == ' ' || b == '\t' || b == '\r' || b == '\n';
    }

    @Override
    public String toString() {
        return kind + "@" + position + "[" + new String(raw, StandardCharsets.UTF_8) + "]";
    }
}
