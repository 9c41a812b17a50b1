/*
 * @LICENSE@
 */

package org.enfa.regex;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The set of characters a regular expression may use as literals. Instances
 * are immutable. An alphabet can never contain one of the operator or
 * grouping characters <code>* | + . ( )</code>.
 */
public final class Alphabet {

    /**
     * The characters reserved by the regex syntax.
     */
    public static final String RESERVED = "*|+.()";

    /**
     * <code>A-Z</code>, <code>a-z</code> and <code>0-9</code>: the default
     * alphabet.
     */
    public static final Alphabet ALPHANUMERIC = new Alphabet(
        "ABCDEFGHIJKLMNOPQRSTUVWXYZ" + "abcdefghijklmnopqrstuvwxyz" + "0123456789");

    private final SortedSet<Character> symbols = new TreeSet<Character>();

    private Alphabet(CharSequence chars) {
        for (int i = 0; i < chars.length(); ++i) {
            char c = chars.charAt(i);
            if (RESERVED.indexOf(c) >= 0) {
                throw new IllegalArgumentException(
                    "reserved character in alphabet: '" + c + "'");
            }
            symbols.add(c);
        }
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("empty alphabet");
        }
    }

    /**
     * @param chars
     *            the characters of the alphabet; duplicates are ignored.
     * @throws IllegalArgumentException
     *             if <code>chars</code> is empty or contains a
     *             {@linkplain #RESERVED reserved} character.
     */
    public static Alphabet of(CharSequence chars) {
        return new Alphabet(chars);
    }

    public boolean contains(int c) {
        return c == (char) c && symbols.contains((char) c);
    }

    public Set<Character> symbols() {
        return Collections.unmodifiableSet(symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Alphabet))
            return false;
        return symbols.equals(((Alphabet) obj).symbols);
    }

    @Override
    public String toString() {
        return Misc.braced(symbols);
    }
}
