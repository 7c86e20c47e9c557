package org.cleanrecent;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Objects;

/**
 * Pull tokenizer turning an XML byte stream into {@link XmlEvent}s, one at a time.
 * <p>
 * Works directly on bytes so that no decoding step can alter the input: concatenating the {@code raw()} bytes of all
 * events yields the original stream. Only the lexical structure is checked (tags are closed, end tags match the
 * open element); nothing is validated beyond that.
 * <p>
 * Not thread-safe; one reader serves one pass.
 */
public final class XmlEventReader {

    private static final byte[] COMMENT_END = "-->".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] CDATA_START = "[CDATA[".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] CDATA_END = "]]>".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] PI_END = "?>".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] DOCTYPE = "DOCTYPE".getBytes(StandardCharsets.US_ASCII);

    private final InputStream in;
    private final Deque<String> open = new ArrayDeque<>();
    private final ByteArrayOutputStream buf = new ByteArrayOutputStream(256);
    private long pos;
    private int peeked = -2;
    private boolean finished;

    public XmlEventReader(InputStream in) {
        Objects.requireNonNull(in, "input stream must not be null");
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
    }

    /**
     * Reads the next event. Once the input is exhausted every further call returns {@code END_OF_STREAM}.
     *
     * @throws MalformedXmlException if the bytes cannot be tokenized
     * @throws IOException           if reading the underlying stream fails
     */
    public XmlEvent next() throws IOException {
        if (finished) return XmlEvent.endOfStream(pos);

        buf.reset();
        long start = pos;
        int b = read();
        if (b < 0) {
            if (!open.isEmpty())
                throw new MalformedXmlException("unexpected end of stream, <" + open.peekLast() + "> is not closed", start);
            finished = true;
            return XmlEvent.endOfStream(start);
        }
        if (b != '<') {
            buf.write(b);
            while ((b = peek()) >= 0 && b != '<') buf.write(read());
            return XmlEvent.of(XmlEvent.Kind.TEXT, buf.toByteArray(), start);
        }

        buf.write(b);
        int c = require(start, "tag");
        buf.write(c);
        switch (c) {
            case '?':
                return processingInstruction(start);
            case '!':
                return markup(start);
            case '/':
                return endTag(start);
            default:
                if (XmlEvent.isWs(c) || c == '>' || c == '=')
                    throw new MalformedXmlException("tag without name", start);
                return startTag(start);
        }
    }

    /* ===================== Token scanners ===================== */

    private XmlEvent processingInstruction(long start) throws IOException {
        readUntil(PI_END, start, "processing instruction");
        byte[] raw = buf.toByteArray();
        // target "xml" (exactly) makes it the declaration
        boolean decl = raw.length > 5 && raw[2] == 'x' && raw[3] == 'm' && raw[4] == 'l'
                && (XmlEvent.isWs(raw[5]) || raw[5] == '?');
        return XmlEvent.of(decl ? XmlEvent.Kind.DECLARATION : XmlEvent.Kind.PROCESSING_INSTRUCTION, raw, start);
    }

    private XmlEvent markup(long start) throws IOException {
        int c = require(start, "markup");
        buf.write(c);
        if (c == '-') {
            int d = require(start, "comment");
            buf.write(d);
            if (d != '-') throw new MalformedXmlException("malformed comment", start);
            readUntil(COMMENT_END, start, "comment");
            return XmlEvent.of(XmlEvent.Kind.COMMENT, buf.toByteArray(), start);
        }
        if (c == '[') {
            expect(CDATA_START, 1, start, "CDATA section");
            readUntil(CDATA_END, start, "CDATA section");
            return XmlEvent.of(XmlEvent.Kind.CDATA, buf.toByteArray(), start);
        }
        if (c == 'D') {
            expect(DOCTYPE, 1, start, "DOCTYPE");
            return doctype(start);
        }
        throw new MalformedXmlException("unknown markup declaration", start);
    }

    private XmlEvent doctype(long start) throws IOException {
        int depth = 0;
        int quote = 0;
        while (true) {
            int b = require(start, "DOCTYPE");
            buf.write(b);
            if (quote != 0) {
                if (b == quote) quote = 0;
            } else if (b == '"' || b == '\'') {
                quote = b;
            } else if (b == '<' && depth > 0) {
                subsetMarkup(start);
            } else if (b == '[') {
                depth++;
            } else if (b == ']') {
                depth--;
            } else if (b == '>' && depth <= 0) {
                return XmlEvent.of(XmlEvent.Kind.DOCTYPE, buf.toByteArray(), start);
            }
        }
    }

    /** Skips a comment or PI of the internal subset, whose text may hold unbalanced quotes. */
    private void subsetMarkup(long start) throws IOException {
        int c = peek();
        if (c == '?') {
            buf.write(read());
            readUntil(PI_END, start, "DOCTYPE");
        } else if (c == '!') {
            buf.write(read());
            if (peek() == '-') {
                buf.write(read());
                int d = require(start, "DOCTYPE");
                buf.write(d);
                if (d != '-') throw new MalformedXmlException("malformed comment in DOCTYPE", start);
                readUntil(COMMENT_END, start, "DOCTYPE");
            }
        }
    }

    private XmlEvent endTag(long start) throws IOException {
        int b;
        while ((b = require(start, "end tag")) != '>') buf.write(b);
        buf.write(b);
        byte[] raw = buf.toByteArray();

        int nameEnd = 2;
        while (nameEnd < raw.length - 1 && !XmlEvent.isWs(raw[nameEnd])) nameEnd++;
        for (int i = nameEnd; i < raw.length - 1; i++) {
            if (!XmlEvent.isWs(raw[i])) throw new MalformedXmlException("garbage in end tag", start);
        }
        String name = new String(raw, 2, nameEnd - 2, StandardCharsets.UTF_8);
        if (name.isEmpty()) throw new MalformedXmlException("end tag without name", start);

        String expected = open.pollLast();
        if (!name.equals(expected)) {
            String msg = expected == null
                    ? "end tag </" + name + "> without open element"
                    : "end tag </" + name + "> does not match <" + expected + ">";
            throw new MalformedXmlException(msg, start);
        }
        return XmlEvent.tag(XmlEvent.Kind.END_TAG, raw, name, start);
    }

    private XmlEvent startTag(long start) throws IOException {
        int quote = 0;
        int b;
        while (true) {
            b = require(start, "tag");
            buf.write(b);
            if (quote != 0) {
                if (b == quote) quote = 0;
            } else if (b == '"' || b == '\'') {
                quote = b;
            } else if (b == '>') {
                break;
            }
        }
        byte[] raw = buf.toByteArray();

        int nameEnd = 1;
        while (nameEnd < raw.length - 1 && !XmlEvent.isWs(raw[nameEnd]) && raw[nameEnd] != '/' && raw[nameEnd] != '>')
            nameEnd++;
        String name = new String(raw, 1, nameEnd - 1, StandardCharsets.UTF_8);

        if (raw[raw.length - 2] == '/') {
            return XmlEvent.tag(XmlEvent.Kind.EMPTY_TAG, raw, name, start);
        }
        open.addLast(name);
        return XmlEvent.tag(XmlEvent.Kind.START_TAG, raw, name, start);
    }

    /* ===================== Byte helpers ===================== */

    private void readUntil(byte[] terminator, long start, String what) throws IOException {
        // sliding window over the bytes read since the opening delimiter
        byte[] window = new byte[terminator.length];
        int seen = 0;
        while (true) {
            int b = require(start, what);
            buf.write(b);
            System.arraycopy(window, 1, window, 0, window.length - 1);
            window[window.length - 1] = (byte) b;
            if (++seen >= window.length && Arrays.equals(window, terminator)) return;
        }
    }

    /** Reads the rest of {@code literal} starting at {@code from}, failing on the first mismatch. */
    private void expect(byte[] literal, int from, long start, String what) throws IOException {
        for (int i = from; i < literal.length; i++) {
            int b = require(start, what);
            buf.write(b);
            if (b != literal[i]) throw new MalformedXmlException("malformed " + what, start);
        }
    }

    private int require(long start, String what) throws IOException {
        int b = read();
        if (b < 0) throw new MalformedXmlException("unexpected end of stream inside " + what, start);
        return b;
    }

    private int peek() throws IOException {
        if (peeked == -2) peeked = in.read();
        return peeked;
    }

    private int read() throws IOException {
        int b;
        if (peeked != -2) {
            b = peeked;
            peeked = -2;
        } else {
            b = in.read();
        }
        if (b >= 0) pos++;
        return b;
    }
}
