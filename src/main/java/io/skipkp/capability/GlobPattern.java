package io.skipkp.capability;

import java.util.regex.Pattern;

/**
 * Shell-style pattern for remote system ids: {@code *} any run, {@code ?} one character,
 * {@code [...]} a character class ({@code [!...]} negated). Matching is case-sensitive and
 * anchored at both ends.
 */
public final class GlobPattern {
    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        if (glob == null || glob.isEmpty()) {
            throw new IllegalArgumentException("glob must not be empty");
        }
        return new GlobPattern(glob, Pattern.compile(toRegex(glob)));
    }

    public boolean matches(String candidate) {
        if (candidate == null) {
            return false;
        }
        return glob.equals(candidate) || regex.matcher(candidate).matches();
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() * 2);
        int i = 0;
        while (i < glob.length()) {
            char ch = glob.charAt(i);
            if (ch == '*') {
                sb.append(".*");
                i++;
            } else if (ch == '?') {
                sb.append('.');
                i++;
            } else if (ch == '[') {
                int close = findClassEnd(glob, i);
                if (close < 0) {
                    // Unterminated class: the bracket is literal.
                    sb.append(Pattern.quote("["));
                    i++;
                } else {
                    sb.append(classToRegex(glob.substring(i + 1, close)));
                    i = close + 1;
                }
            } else {
                int next = i;
                while (next < glob.length() && "*?[".indexOf(glob.charAt(next)) < 0) {
                    next++;
                }
                sb.append(Pattern.quote(glob.substring(i, next)));
                i = next;
            }
        }
        return sb.toString();
    }

    private static int findClassEnd(String glob, int open) {
        int j = open + 1;
        if (j < glob.length() && (glob.charAt(j) == '!' || glob.charAt(j) == '^')) {
            j++;
        }
        // A leading ']' is part of the class.
        if (j < glob.length() && glob.charAt(j) == ']') {
            j++;
        }
        while (j < glob.length()) {
            if (glob.charAt(j) == ']') {
                return j;
            }
            j++;
        }
        return -1;
    }

    private static String classToRegex(String body) {
        StringBuilder sb = new StringBuilder("[");
        int start = 0;
        if (!body.isEmpty() && (body.charAt(0) == '!' || body.charAt(0) == '^')) {
            sb.append('^');
            start = 1;
        }
        for (int k = start; k < body.length(); k++) {
            char c = body.charAt(k);
            if (c == '-' && k > start && k < body.length() - 1) {
                sb.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            } else {
                sb.append('\\').append(c);
            }
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
