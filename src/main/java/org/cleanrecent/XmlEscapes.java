package org.cleanrecent;

import java.nio.charset.StandardCharsets;

/**
 * Resolves the predefined XML entities and numeric character references in raw text.
 */
final class XmlEscapes {

    private XmlEscapes() {
    }

    /**
     * Decodes {@code raw} as UTF-8 (lossily) and resolves {@code &lt; &gt; &amp; &apos; &quot;} as well as
     * {@code &#NN;} and {@code &#xNN;}.
     *
     * @param raw      text bytes as they appear in the document
     * @param position byte offset of the text, used for error reporting
     * @throws MalformedXmlException on an unknown or unterminated reference
     */
    static String unescape(byte[] raw, long position) throws MalformedXmlException {
        String s = new String(raw, StandardCharsets.UTF_8);
        int amp = s.indexOf('&');
        if (amp < 0) return s;

        StringBuilder sb = new StringBuilder(s.length());
        int from = 0;
        while (amp >= 0) {
            sb.append(s, from, amp);
            int semi = s.indexOf(';', amp);
            if (semi < 0) throw new MalformedXmlException("unterminated entity reference", position);
            String ref = s.substring(amp + 1, semi);
            sb.appendCodePoint(resolve(ref, position));
            from = semi + 1;
            amp = s.indexOf('&', from);
        }
        sb.append(s, from, s.length());
        return sb.toString();
    }

    private static int resolve(String ref, long position) throws MalformedXmlException {
        switch (ref) {
            case "lt":
                return '<';
            case "gt":
                return '>';
            case "amp":
                return '&';
            case "apos":
                return '\'';
            case "quot":
                return '"';
            default:
                break;
        }
        if (ref.startsWith("#")) {
            try {
                int cp = ref.startsWith("#x")
                        ? Integer.parseInt(ref.substring(2), 16)
                        : Integer.parseInt(ref.substring(1), 10);
                if (Character.isValidCodePoint(cp)) return cp;
            } catch (NumberFormatException e) {
                throw new MalformedXmlException("invalid character reference &" + ref + ";", position);
            }
        }
        throw new MalformedXmlException("unknown entity &" + ref + ";", position);
    }
}
