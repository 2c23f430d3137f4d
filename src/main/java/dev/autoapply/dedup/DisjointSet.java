package dev.autoapply.dedup;

import java.util.Arrays;

/**
 * Union-find over the dense index range [0, size), with path halving and
 * union by rank.
 */
public class DisjointSet {

    private final int[] parent;
    private final byte[] rank;

    public DisjointSet(int size) {
        this.parent = new int[size];
        this.rank = new byte[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    public int find(int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /**
     * @return true if the two elements were in different sets
     */
    public boolean union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) {
            return false;
        }
        if (rank[ra] < rank[rb]) {
            parent[ra] = rb;
        } else if (rank[ra] > rank[rb]) {
            parent[rb] = ra;
        } else {
            parent[rb] = ra;
            rank[ra]++;
        }
        return true;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    public int size() {
        return parent.length;
    }

    @Override
    public String toString() {
        return "DisjointSet" + Arrays.toString(parent);
    }
}
