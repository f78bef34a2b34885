package nl.bytesoflife.deltascad.sentence.primitive;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation of point index lists (polygon paths, polyhedron faces).
 */
final class IndexLists {

    private IndexLists() {
    }

    /**
     * @param kind what the lists are, used in the error message
     */
    static List<List<Integer>> copyChecked(String kind, List<List<Integer>> lists, int pointCount) {
        List<List<Integer>> copy = new ArrayList<>(lists.size());
        for (int i = 0; i < lists.size(); i++) {
            List<Integer> list = lists.get(i);
            for (int j = 0; j < list.size(); j++) {
                Integer index = list.get(j);
                if (index == null || index < 0 || index >= pointCount) {
                    throw new IllegalArgumentException(
                            kind + " index out of bounds: [" + i + "][" + j + "]:" + index);
                }
            }
            copy.add(List.copyOf(list));
        }
        return List.copyOf(copy);
    }
}
