package SymDFA;

import java.util.ArrayList;
import java.util.List;

public class Words {
    /**
     * All words over symbols of length at most maxLength, shortest first.
     */
    public static <I> List<List<I>> upTo(List<I> symbols, int maxLength) {
        List<List<I>> result = new ArrayList<>();
        List<List<I>> layer = new ArrayList<>();
        layer.add(List.of());
        for (int length = 0; length <= maxLength; length++) {
            result.addAll(layer);
            List<List<I>> next = new ArrayList<>();
            for (List<I> word : layer) {
                for (I a : symbols) {
                    List<I> longer = new ArrayList<>(word);
                    longer.add(a);
                    next.add(longer);
                }
            }
            layer = next;
        }
        return result;
    }
}
