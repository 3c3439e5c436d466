package nl.bytesoflife.deltakicad.sexpr;

import java.util.List;

/**
 * Line-break shape of a parsed list: how many line breaks preceded each child
 * and the closing parenthesis. Indentation itself is not stored; the writer
 * regenerates it from the nesting depth.
 */
public record ListLayout(List<Integer> breaksBefore, int breaksBeforeClose) {

    public ListLayout {
        breaksBefore = List.copyOf(breaksBefore);
    }

    public int size() {
        return breaksBefore.size();
    }

    public int breaksBefore(int childIndex) {
        return breaksBefore.get(childIndex);
    }
}
