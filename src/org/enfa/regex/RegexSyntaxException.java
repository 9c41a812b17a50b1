/*
 * @LICENSE@
 */

package org.enfa.regex;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a regular expression cannot be turned into an automaton. Besides
 * the description, regex and index of {@link PatternSyntaxException}, carries
 * the offending character and what preceded it.
 */
public final class RegexSyntaxException extends PatternSyntaxException {

    private static final long serialVersionUID = 1L;

    /**
     * Value of {@link #offending()} when the error is found at the end of
     * the regex rather than at a particular character.
     */
    public static final int END = -1;

    private final int offending;
    private final String previous;

    RegexSyntaxException(String desc, String regex, int index, int offending,
            String previous) {
        super(desc, regex, index);
        this.offending = offending;
        this.previous = previous;
    }

    /**
     * @return the offending character, or {@link #END}.
     */
    public int offending() {
        return offending;
    }

    /**
     * @return the preceding token (e.g. <code>'('</code>), or a fixed
     *         description such as <code>"start of expression"</code>,
     *         <code>"empty stack"</code> or <code>"inadequate operands"</code>.
     */
    public String previous() {
        return previous;
    }
}
