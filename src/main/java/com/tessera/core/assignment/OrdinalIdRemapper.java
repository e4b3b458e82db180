package com.tessera.core.assignment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps foreign item ids onto canonical ones by position after sorting both sides in
 * natural order ({@code task_2} before {@code task_10}). This is a best-effort bridge for
 * optimizers that renumber items; it only works when both sides number the same items
 * in the same order, and it refuses to guess when the counts differ.
 */
public final class OrdinalIdRemapper {

    /**
     * Digit-aware ordering: runs of digits compare numerically, everything else
     * case-insensitively.
     */
    public static final Comparator<String> NATURAL = OrdinalIdRemapper::compareNatural;

    private OrdinalIdRemapper() {} // utility class

    /**
     * @return foreign id to canonical id, or empty when the distinct counts differ
     */
    public static Optional<Map<String, String>> remap(Collection<String> foreignIds, Collection<String> canonicalIds) {
        List<String> foreign = new ArrayList<>(new LinkedHashSet<>(foreignIds));
        List<String> canonical = new ArrayList<>(new LinkedHashSet<>(canonicalIds));
        if (foreign.size() != canonical.size()) {
            return Optional.empty();
        }
        foreign.sort(NATURAL);
        canonical.sort(NATURAL);
        var mapping = new LinkedHashMap<String, String>();
        for (int i = 0; i < foreign.size(); i++) {
            mapping.put(foreign.get(i), canonical.get(i));
        }
        return Optional.of(mapping);
    }

    static int compareNatural(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int si = i;
                int sj = j;
                while (i < a.length() && Character.isDigit(a.charAt(i))) {
                    i++;
                }
                while (j < b.length() && Character.isDigit(b.charAt(j))) {
                    j++;
                }
                String na = stripLeadingZeros(a.substring(si, i));
                String nb = stripLeadingZeros(b.substring(sj, j));
                int cmp = na.length() != nb.length() ? Integer.compare(na.length(), nb.length()) : na.compareTo(nb);
                if (cmp != 0) {
                    return cmp;
                }
            } else {
                int cmp = Character.compare(Character.toLowerCase(ca), Character.toLowerCase(cb));
                if (cmp != 0) {
                    return cmp;
                }
                i++;
                j++;
            }
        }
        int remaining = Integer.compare(a.length() - i, b.length() - j);
        return remaining != 0 ? remaining : a.compareTo(b);
    }

    private static String stripLeadingZeros(String digits) {
        int k = 0;
        while (k < digits.length() - 1 && digits.charAt(k) == '0') {
            k++;
        }
        return digits.substring(k);
    }
}
