/* @LICENSE@
 */

package org.enfa.regex;

import static org.enfa.regex.Thompson.concat;
import static org.enfa.regex.Thompson.literal;
import static org.enfa.regex.Thompson.star;
import static org.enfa.regex.Thompson.union;

import java.util.LinkedList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator precedence parser driving the {@linkplain Thompson combinators}.
 * <p>
 * Syntax: alphabet characters are literals; <code>*</code> is postfix Kleene
 * star (binds tightest); <code>.</code> is explicit concatenation, also implied
 * between adjacent operands; <code>|</code> and <code>+</code> are union
 * (loosest); <code>(</code> and <code>)</code> group.
 */
final class RegexParser {

    private static final Logger logger = Logger.getLogger("org.enfa.regex");
    private static final Level level = Level.FINER;

    private static final char STAR = '*';
    private static final char UNION = '|';
    private static final char UNION_PLUS = '+';
    private static final char DOT = '.';
    private static final char OPEN = '(';
    private static final char CLOSE = ')';

    private static final int SOX = -1;  // start of expression

    private final Alphabet alphabet;

    RegexParser() {
        this(Alphabet.ALPHANUMERIC);
    }

    RegexParser(Alphabet alphabet) {
        if (alphabet == null) {
            throw new NullPointerException("alphabet");
        }
        this.alphabet = alphabet;
    }

    Alphabet alphabet() {
        return alphabet;
    }

    /**
     * @return the automaton for <code>regex</code>.
     * @throws RegexSyntaxException
     *             if <code>regex</code> is malformed; nothing is built.
     */
    CompositeAutomaton parse(String regex) {
        if (regex == null) {
            throw new NullPointerException("regex");
        }
        logger.log(level, "regex: {0}", regex);
        CompositeAutomaton ret = new Scan(regex).run();
        if (logger.isLoggable(level)) {
            logger.log(level, "nfa: " + ret.size() + " states", ret);
        }
        return ret;
    }

    /*
     * pending operator, with its position for error reporting
     */
    private static final class Token {
        final char op;
        final char written;
        final int index;
        Token(char op, int index) {
            this(op, op, index);
        }
        Token(char op, char written, int index) {
            this.op = op;
            this.written = written;
            this.index = index;
        }
        @Override
        public String toString() {
            return written + "@" + index;
        }
    }

    /*
     * working state of one parse; the stacks never outlive run()
     */
    private final class Scan {

        final String regex;
        final LinkedList<CompositeAutomaton> operands = new LinkedList<CompositeAutomaton>();
        final LinkedList<Token> operators = new LinkedList<Token>();
        int previous = SOX;

        Scan(String regex) {
            this.regex = regex;
        }

        CompositeAutomaton run() {
            for (int i = 0; i < regex.length(); ++i) {
                final char c = regex.charAt(i);
                if (alphabet.contains(c)) {
                    if (impliesConcat()) {
                        pushOperator(new Token(DOT, i));
                    }
                    operands.addFirst(literal(c));
                } else if (c == OPEN) {
                    if (impliesConcat()) {
                        pushOperator(new Token(DOT, i));
                    }
                    operators.addFirst(new Token(OPEN, i));
                } else if (c == CLOSE) {
                    if (isBinary(previous) || previous == OPEN) {
                        misplaced(c, i);
                    }
                    while (true) {
                        if (operators.isEmpty()) {
                            syntaxError("Error processing '" + c + "'. Empty stack",
                                i, c, "empty stack");
                        }
                        Token t = operators.removeFirst();
                        if (t.op == OPEN) break;
                        apply(t);
                    }
                } else if (c == STAR) {
                    if (previous == SOX || isBinary(previous)
                            || previous == OPEN || previous == STAR) {
                        misplaced(c, i);
                    }
                    operands.addFirst(star(operands.removeFirst()));
                } else if (isBinary(c)) {
                    if (previous == SOX || isBinary(previous) || previous == OPEN) {
                        misplaced(c, i);
                    }
                    pushOperator(new Token(c == UNION_PLUS ? UNION : c, c, i));
                } else {
                    syntaxError("Symbol '" + Misc.Esc.JAVA.esc(c) + "' is not allowed",
                        i, c, describe(previous));
                }
                previous = c;
            }
            while (!operators.isEmpty()) {
                Token t = operators.removeFirst();
                if (t.op == OPEN) {
                    syntaxError("Unbalanced parenthesis: '(' is never closed",
                        t.index, OPEN, "end of expression");
                }
                apply(t);
            }
            if (operands.isEmpty()) {
                syntaxError("Empty expression",
                    -1, RegexSyntaxException.END, describe(previous));
            }
            if (operands.size() > 1) {
                syntaxError("Regex could not be parsed successfully",
                    -1, RegexSyntaxException.END, operands.size() + " automata left");
            }
            return operands.removeFirst();
        }

        /*
         * concatenation is implicit after an operand: a literal, ')' or '*'
         */
        private boolean impliesConcat() {
            return alphabet.contains(previous) || previous == CLOSE || previous == STAR;
        }

        /*
         * equal operators associate left; concatenation binds tighter than
         * union
         */
        private void pushOperator(Token incoming) {
            while (!operators.isEmpty()) {
                Token top = operators.getFirst();
                if (top.op == OPEN) break;
                if (top.op == incoming.op || top.op == DOT) {
                    apply(operators.removeFirst());
                } else break;
            }
            operators.addFirst(incoming);
        }

        private void apply(Token t) {
            assert t.op == UNION || t.op == DOT : t;
            if (operands.isEmpty()) {
                syntaxError("Error processing operator '" + t.written + "'. Stack is empty",
                    t.index, t.written, "empty stack");
            }
            if (operands.size() < 2) {
                syntaxError("Error processing operator '" + t.written + "'. Inadequate operands",
                    t.index, t.written, "inadequate operands");
            }
            CompositeAutomaton right = operands.removeFirst();
            CompositeAutomaton left = operands.removeFirst();
            operands.addFirst(t.op == UNION ? union(left, right) : concat(left, right));
        }

        private void misplaced(char c, int i) {
            syntaxError("Error processing '" + c + "' after " + describe(previous),
                i, c, describe(previous));
        }

        private void syntaxError(String msg, int index, int offending, String previous) {
            throw new RegexSyntaxException(msg, regex, index, offending, previous);
        }
    }

    private static boolean isBinary(int c) {
        return c == UNION || c == UNION_PLUS || c == DOT;
    }

    private static String describe(int token) {
        return token == SOX ? "start of expression" : "'" + Misc.Esc.JAVA.esc(token) + "'";
    }
}
