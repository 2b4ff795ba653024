/*
 * @LICENSE@
 */

package org.multisearch;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    /*
     * So many iterators don't suport remove()
     */
    static abstract class ImmutableIterator<E> implements Iterator<E> {
        public final void remove() {
            throw new UnsupportedOperationException("sorry!");
        }
    }

    /**
     * Number of bytes needed to encode a code point in UTF-8. Lone surrogates
     * count as three, which is what a lenient encoder would emit for them.
     */
    static int utf8Width(int cp) {
        if (cp < 0x80) return 1;
        if (cp < 0x800) return 2;
        if (cp < 0x10000) return 3;
        return 4;
    }

    static int utf8Length(CharSequence cs) {
        int n = 0;
        for (int i = 0; i < cs.length(); ) {
            int cp = Character.codePointAt(cs, i);
            n += utf8Width(cp);
            i += Character.charCount(cp);
        }
        return n;
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper jsEscaper =
            new MapEscaper().map('\\', "\\\\").map('"', "\\\"");

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (c < 32 || 126 < c) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, "\\u");
                ret = true;
            }
            return ret;
        }
    };

    /**
     * Singleton escapers used to render terms and edge labels in debug dumps.
     */
    enum Esc {

        /**
         * JSON string escaper - escapes " and \, non-printable-ASCII and beyond
         * -> \\u codes (per UTF-16 unit, so surrogate pairs come out as two)
         */
        JSON(jsEscaper, unicodeEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, char c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append(c);
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (int i = 0; i < cs.length(); ++i) {
                esc(sb, cs.charAt(i));
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }

        /**
         * Appends <code>cs</code> as a double quoted, escaped literal.
         */
        void quote(StringBuilder sb, CharSequence cs) {
            sb.append('"');
            esc(sb, cs);
            sb.append('"');
        }
    }
}
