package org.hastats.migrations.pipeline.classify;

import java.util.regex.Pattern;

/**
 * Case-insensitive glob supporting {@code *} and {@code ?}. A {@code %} is read as {@code *}
 * so SQL LIKE-style patterns from older configurations keep working.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        if (glob == null || glob.isBlank()) {
            throw new IllegalArgumentException("Glob pattern must not be blank");
        }
        var sb = new StringBuilder();
        var literal = new StringBuilder();
        for (char c : glob.trim().toCharArray()) {
            if (c == '*' || c == '%' || c == '?') {
                flushLiteral(sb, literal);
                sb.append(c == '?' ? "." : ".*");
            } else {
                literal.append(c);
            }
        }
        flushLiteral(sb, literal);
        return new GlobPattern(glob, Pattern.compile(sb.toString(),
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL));
    }

    private static void flushLiteral(StringBuilder sb, StringBuilder literal) {
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    public boolean matches(String text) {
        return text != null && regex.matcher(text).matches();
    }

    @Override
    public String toString() {
        return glob;
    }
}
