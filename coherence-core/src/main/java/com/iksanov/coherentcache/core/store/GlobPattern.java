package com.iksanov.coherentcache.core.store;

import java.util.regex.Pattern;

/**
 * Redis-style key globs ({@code *}, {@code ?}) for stores without native pattern matching.
 */
final class GlobPattern {

    private GlobPattern() {}

    static Pattern compile(String glob) {
        if (glob == null || glob.isEmpty()) throw new IllegalArgumentException("pattern is empty");
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) regex.append(Pattern.quote(literal.toString()));
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
