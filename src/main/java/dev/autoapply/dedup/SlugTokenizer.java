package dev.autoapply.dedup;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns posting URLs into slug token sets.
 * <p>
 * For {@code https://apply.workable.com/j/view/5A1B2C/senior-java-engineer-remote}
 * with marker {@code /view/} the slug is {@code senior-java-engineer-remote}.
 */
public class SlugTokenizer {

    private static final Pattern SEPARATORS = Pattern.compile("[\\W_]+");

    private final String listingMarker;
    private final int minTokenLength;

    public SlugTokenizer(String listingMarker, int minTokenLength) {
        this.listingMarker = listingMarker;
        this.minTokenLength = minTokenLength;
    }

    /**
     * The path after the listing marker with the listing id segment removed.
     * Empty when the marker is missing.
     */
    public String extractSlug(String url) {
        if (url == null) {
            return "";
        }
        int markerAt = url.indexOf(listingMarker);
        if (markerAt < 0) {
            return "";
        }
        String rest = url.substring(markerAt + listingMarker.length());
        int slash = rest.indexOf('/');
        String slug = rest.substring(slash + 1);
        int queryAt = indexOfAny(slug, '?', '#');
        return queryAt >= 0 ? slug.substring(0, queryAt) : slug;
    }

    public Set<String> tokenize(String slug) {
        Set<String> tokens = new LinkedHashSet<>();
        if (slug == null || slug.isEmpty()) {
            return tokens;
        }
        for (String token : SEPARATORS.split(slug.toLowerCase(Locale.ROOT))) {
            if (token.length() >= minTokenLength) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public Set<String> tokensOf(String url) {
        return tokenize(extractSlug(url));
    }

    /**
     * |A ∩ B| / |A ∪ B|; 0 when both sets are empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int intersection = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }

    private static int indexOfAny(String s, char first, char second) {
        int a = s.indexOf(first);
        int b = s.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }
}
