/*
 * @LICENSE@
 */

package org.enfa.regex;

import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects and methods shared by the automaton, the parser and the exporters.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * printable form of the epsilon sentinel
     */
    static final String EPSILON_LABEL = ":e:";

    /**
     * @return the label of a transition symbol: the character itself, or
     *         {@value #EPSILON_LABEL} for {@link Automaton#EPSILON}.
     */
    static String symbolString(int symbol) {
        return symbol == Automaton.EPSILON
                ? EPSILON_LABEL
                : String.valueOf((char) symbol);
    }

    /*
     * "{1, 2, 3}"
     */
    static String braced(Collection<?> c) {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        for (Iterator<?> i = c.iterator(); i.hasNext();) {
            sb.append(i.next());
            if (i.hasNext()) sb.append(", ");
        }
        sb.append('}');
        return sb.toString();
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
            if (c < 0) {
                sb.append("0x" + Integer.toHexString(c));
                ret = true;
            } else if (c < 32 || 126 < c) {
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
     * A collection of singleton objects which implement methods used to create
     * Strings where certain characters are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Java lang escaper - escapes " and \, non-printable-ASCI and beyond ->
         * \\u codes.
         */
        JAVA(jsEscaper, unicodeEscaper),

        /**
         * GraphViz quoted ids and labels - escapes " and \ only; other
         * characters pass through, the graph description being UTF-8.
         */
        DOT(jsEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
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
    }
}
