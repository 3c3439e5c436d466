package nl.bytesoflife.deltakicad.fidelity;

import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Tracks which children of one element a mapper turned into model fields.
 * Whatever is not marked here is kept raw by {@link #capture}.
 * <p>
 * Nodes are matched by identity: two equal children are still two slots.
 */
public final class ConsumedNodes {

    private final Map<SNode, Object> keys = new IdentityHashMap<>();

    public <N extends SNode> N mark(N node, Object key) {
        if (node != null) {
            keys.put(node, key);
        }
        return node;
    }

    public <T> EncodedValue<T> mark(EncodedValue<T> field, Object key) {
        if (field.getSource() != null) {
            keys.put(field.getSource(), key);
        }
        return field;
    }

    public ChildOrder capture(SList source, int positional) {
        return ChildOrder.capture(source, positional, keys::get);
    }
}
