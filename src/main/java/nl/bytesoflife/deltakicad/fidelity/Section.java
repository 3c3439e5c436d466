package nl.bytesoflife.deltakicad.fidelity;

import nl.bytesoflife.deltakicad.sexpr.SNode;

import java.util.Objects;

/**
 * One child slot of a modeled element: either a value the mapping layer
 * understands, or a subtree it does not model and keeps verbatim.
 */
public sealed interface Section<T> permits Section.Modeled, Section.Unmodeled {

    /**
     * @param value  the modeled value, or the key of the field it feeds
     * @param source the node it was read from, null when created in memory
     */
    record Modeled<T>(T value, SNode source) implements Section<T> {
        public Modeled {
            Objects.requireNonNull(value, "value");
        }
    }

    record Unmodeled<T>(SNode node) implements Section<T> {
        public Unmodeled {
            Objects.requireNonNull(node, "node");
        }
    }

    static <T> Section<T> modeled(T value, SNode source) {
        return new Modeled<>(value, source);
    }

    static <T> Section<T> unmodeled(SNode node) {
        return new Unmodeled<>(node);
    }
}
