package dev.autoapply.dedup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups postings whose slug token sets are similar enough, transitively.
 * <p>
 * Candidate pairs come from an inverted token index, so only links sharing
 * at least one token are ever compared. The lowest id of every cluster is
 * canonical; all other members are reported for demotion.
 */
public class LinkClusterer {

    /**
     * A posting to cluster.
     */
    public record SlugSource(long id, String url) {
    }

    /**
     * Clusters with more than one member, each sorted ascending, plus the
     * non-canonical ids of all of them.
     */
    public record Result(List<List<Long>> clusters, List<Long> duplicateIds, int comparisons) {
    }

    private final SlugTokenizer tokenizer;
    private final double threshold;

    public LinkClusterer(SlugTokenizer tokenizer, double threshold) {
        this.tokenizer = tokenizer;
        this.threshold = threshold;
    }

    public Result cluster(List<SlugSource> links) {
        List<SlugSource> sorted = new ArrayList<>(links);
        sorted.sort(Comparator.comparingLong(SlugSource::id));
        int n = sorted.size();

        List<Set<String>> tokens = new ArrayList<>(n);
        Map<String, List<Integer>> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            Set<String> linkTokens = tokenizer.tokensOf(sorted.get(i).url());
            tokens.add(linkTokens);
            for (String token : linkTokens) {
                index.computeIfAbsent(token, t -> new ArrayList<>()).add(i);
            }
        }

        DisjointSet sets = new DisjointSet(n);
        int[] lastCandidateOf = new int[n];
        Arrays.fill(lastCandidateOf, -1);
        int comparisons = 0;

        for (int i = 0; i < n; i++) {
            for (String token : tokens.get(i)) {
                for (int j : index.get(token)) {
                    // each unordered pair once: only look forward
                    if (j <= i || lastCandidateOf[j] == i) {
                        continue;
                    }
                    lastCandidateOf[j] = i;
                    if (sets.connected(i, j)) {
                        continue;
                    }
                    comparisons++;
                    if (SlugTokenizer.jaccard(tokens.get(i), tokens.get(j)) >= threshold) {
                        sets.union(i, j);
                    }
                }
            }
        }

        // indices ascend with ids, so the first member seen per root is the canonical one
        Map<Integer, List<Long>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            byRoot.computeIfAbsent(sets.find(i), r -> new ArrayList<>()).add(sorted.get(i).id());
        }

        List<List<Long>> clusters = new ArrayList<>();
        List<Long> duplicates = new ArrayList<>();
        for (List<Long> members : byRoot.values()) {
            if (members.size() > 1) {
                clusters.add(List.copyOf(members));
                duplicates.addAll(members.subList(1, members.size()));
            }
        }
        return new Result(clusters, duplicates, comparisons);
    }
}
