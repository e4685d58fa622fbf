package controlmap.domain.merge;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The Ratcliff/Obershelp "gestalt pattern matching" ratio: find the longest common block, recurse into the
 * text on either side of it, and return 2 * matched / (len(a) + len(b)).
 * <p>
 * There is no junk function, but elements of b that occur more than len(b) / 100 + 1 times are ignored
 * when b has 200 or more elements. The dedup threshold was tuned against this exact metric. The result is
 * not symmetric, so a and b must always be passed in the same order.
 * Strings are compared by Unicode code point.
 */
@ApplicationScoped
public class RatcliffObershelpSimilarity implements TextSimilarity {
    private static final int AUTOJUNK_MIN_LENGTH = 200;

    @Override
    public double ratio(final String a, final String b) {
        final int[] first = a.codePoints().toArray();
        final int[] second = b.codePoints().toArray();

        final int length = first.length + second.length;
        if (length == 0) {
            return 1.0;
        }

        return 2.0 * matchingCharacters(first, second) / length;
    }

    private int matchingCharacters(final int[] a, final int[] b) {
        final Map<Integer, int[]> positionsInB = indexPositions(b);

        int matches = 0;
        final Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length, 0, b.length});

        while (!queue.isEmpty()) {
            final int[] range = queue.pop();
            final int alo = range[0];
            final int ahi = range[1];
            final int blo = range[2];
            final int bhi = range[3];

            final int[] match = findLongestMatch(a, b, positionsInB, alo, ahi, blo, bhi);
            final int i = match[0];
            final int j = match[1];
            final int size = match[2];

            if (size > 0) {
                matches += size;
                if (alo < i && blo < j) {
                    queue.push(new int[]{alo, i, blo, j});
                }
                if (i + size < ahi && j + size < bhi) {
                    queue.push(new int[]{i + size, ahi, j + size, bhi});
                }
            }
        }

        return matches;
    }

    /**
     * Maps each element of b to the ascending positions it occurs at. When b is long, elements that occur in
     * more than 1% of the positions are dropped.
     */
    private Map<Integer, int[]> indexPositions(final int[] b) {
        final Map<Integer, List<Integer>> positions = new HashMap<>();
        for (int j = 0; j < b.length; j++) {
            positions.computeIfAbsent(b[j], key -> new ArrayList<>()).add(j);
        }

        final Map<Integer, int[]> index = new HashMap<>();
        final int popularLimit = b.length / 100 + 1;

        positions.forEach((element, list) -> {
            if (b.length < AUTOJUNK_MIN_LENGTH || list.size() <= popularLimit) {
                index.put(element, list.stream().mapToInt(Integer::intValue).toArray());
            }
        });

        return index;
    }

    /**
     * Finds the longest block a[i:i+size] == b[j:j+size] within the given ranges. Of all blocks of maximal
     * size, the one that starts earliest in a is returned, and of those the one that starts earliest in b.
     *
     * @return {i, j, size}
     */
    private int[] findLongestMatch(final int[] a,
                                   final int[] b,
                                   final Map<Integer, int[]> positionsInB,
                                   final int alo,
                                   final int ahi,
                                   final int blo,
                                   final int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestSize = 0;

        // lengths of the blocks ending at a[i - 1], keyed by the position in b they end at
        Map<Integer, Integer> blockLengths = new HashMap<>();

        for (int i = alo; i < ahi; i++) {
            final Map<Integer, Integer> newBlockLengths = new HashMap<>();
            final int[] positions = positionsInB.get(a[i]);

            if (positions != null) {
                for (final int j : positions) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }

                    final int size = blockLengths.getOrDefault(j - 1, 0) + 1;
                    newBlockLengths.put(j, size);

                    if (size > bestSize) {
                        besti = i - size + 1;
                        bestj = j - size + 1;
                        bestSize = size;
                    }
                }
            }

            blockLengths = newBlockLengths;
        }

        // Popular elements were left out of the index, so grow the block over any equal neighbours
        while (besti > alo && bestj > blo && a[besti - 1] == b[bestj - 1]) {
            besti--;
            bestj--;
            bestSize++;
        }

        while (besti + bestSize < ahi && bestj + bestSize < bhi && a[besti + bestSize] == b[bestj + bestSize]) {
            bestSize++;
        }

        return new int[]{besti, bestj, bestSize};
    }
}
