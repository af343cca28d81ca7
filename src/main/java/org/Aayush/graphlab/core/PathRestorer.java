package org.Aayush.graphlab.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Rebuilds explicit vertex paths from a parent table.
 */
@UtilityClass
public final class PathRestorer {

    private static final int[] NO_PATH = new int[0];

    /**
     * Walks {@code parent} back from {@code target} to {@code source}.
     * <p>
     * Returns an empty array when the target is out of range, has no parent and is not the
     * source, or when the walk ends (or loops for more than {@code parent.length} steps)
     * without meeting the source.
     * </p>
     *
     * @return vertices from {@code source} to {@code target} inclusive, or an empty array.
     */
    public static int[] restorePath(int source, int target, int[] parent) {
        Objects.requireNonNull(parent, "parent");
        int n = parent.length;
        if (target < 0 || target >= n) {
            return NO_PATH;
        }
        if (parent[target] == ShortestPathResult.NO_PARENT && target != source) {
            return NO_PATH;
        }

        IntArrayList reversed = new IntArrayList();
        int v = target;
        while (true) {
            reversed.add(v);
            if (v == source) break;
            v = parent[v];
            // A chain longer than n vertices revisits one: the parent table is cyclic.
            if (v < 0 || v >= n || reversed.size() >= n) {
                return NO_PATH;
            }
        }

        int[] path = new int[reversed.size()];
        for (int i = 0; i < path.length; i++) {
            path[i] = reversed.getInt(path.length - 1 - i);
        }
        return path;
    }

    /**
     * Restores a path from the parent table of {@code result}.
     */
    public static int[] restorePath(ShortestPathResult result, int source, int target) {
        Objects.requireNonNull(result, "result");
        return restorePath(source, target, result.parentsCopy());
    }

    /**
     * Formats a path as {@code 0 -> 1 -> 2}, or {@code "no path"} when empty.
     */
    public static String format(int[] path) {
        if (path.length == 0) {
            return "no path";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < path.length; i++) {
            if (i > 0) sb.append(" -> ");
            sb.append(path[i]);
        }
        return sb.toString();
    }
}
