package com.upgradedoctor.check;

import java.util.regex.Pattern;

/**
 * Shell-style glob compiled to a regular expression.
 *
 * Syntax:
 *   *        any sequence of characters except '/'
 *   ?        any single character except '/'
 *   [abc]    one character from the class; [^abc] negates, [a-z] is a range
 *   \c       matches c literally
 *
 * Malformed patterns (unterminated class, empty class, dangling range or escape) are rejected
 * at compile time with {@link InvalidPatternException}, whatever the input they would be
 * matched against.
 */
final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    static GlobPattern compile(String glob) {
        StringBuilder re = new StringBuilder("^");
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> {
                    re.append("[^/]*");
                    i++;
                }
                case '?' -> {
                    re.append("[^/]");
                    i++;
                }
                case '[' -> i = appendClass(glob, i, re);
                case '\\' -> {
                    if (i + 1 >= glob.length()) {
                        throw invalid(glob, "trailing escape");
                    }
                    re.append(Pattern.quote(String.valueOf(glob.charAt(i + 1))));
                    i += 2;
                }
                default -> {
                    re.append(Pattern.quote(String.valueOf(c)));
                    i++;
                }
            }
        }
        re.append('$');
        return new GlobPattern(glob, Pattern.compile(re.toString()));
    }

    boolean matches(String input) {
        return regex.matcher(input).matches();
    }

    @Override
    public String toString() {
        return glob;
    }

    /** Translates the class starting at {@code start} ('[') and returns the index after its ']'. */
    private static int appendClass(String glob, int start, StringBuilder re) {
        int i = start + 1;
        boolean negated = i < glob.length() && glob.charAt(i) == '^';
        if (negated) i++;

        StringBuilder cls = new StringBuilder(negated ? "[^" : "[");
        int ranges = 0;
        while (true) {
            if (i >= glob.length()) {
                throw invalid(glob, "unterminated character class");
            }
            if (glob.charAt(i) == ']' && ranges > 0) {
                i++;
                break;
            }
            char[] lo = new char[1];
            i = readClassChar(glob, i, lo);
            char hi = lo[0];
            if (i < glob.length() && glob.charAt(i) == '-') {
                char[] h = new char[1];
                i = readClassChar(glob, i + 1, h);
                hi = h[0];
                if (hi < lo[0]) {
                    throw invalid(glob, "invalid range " + lo[0] + "-" + hi);
                }
            }
            cls.append(escapeClassChar(lo[0]));
            if (hi != lo[0]) {
                cls.append('-').append(escapeClassChar(hi));
            }
            ranges++;
        }
        re.append(cls).append(']');
        return i;
    }

    private static int readClassChar(String glob, int i, char[] out) {
        if (i >= glob.length()) {
            throw invalid(glob, "unterminated character class");
        }
        char c = glob.charAt(i);
        if (c == '-' || c == ']') {
            throw invalid(glob, "unexpected '" + c + "' in character class");
        }
        if (c == '\\') {
            if (i + 1 >= glob.length()) {
                throw invalid(glob, "trailing escape");
            }
            out[0] = glob.charAt(i + 1);
            return i + 2;
        }
        out[0] = c;
        return i + 1;
    }

    private static String escapeClassChar(char c) {
        return "\\[]^-&".indexOf(c) >= 0 ? "\\" + c : String.valueOf(c);
    }

    private static InvalidPatternException invalid(String glob, String detail) {
        return new InvalidPatternException("invalid pattern \"" + glob + "\": " + detail);
    }
}
