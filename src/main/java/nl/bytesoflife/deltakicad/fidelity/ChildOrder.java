package nl.bytesoflife.deltakicad.fidelity;

import nl.bytesoflife.deltakicad.sexpr.ListLayout;
import nl.bytesoflife.deltakicad.sexpr.SExpressionBuilder;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Remembers the order of an element's children as read from a file: which
 * slots were modeled fields (by key) and which were subtrees kept verbatim.
 * <p>
 * When the element is written back, modeled fields are placed where they
 * were found and raw subtrees are re-inserted between them unchanged. A
 * freshly emitted field that is equal to the node it was read from is
 * replaced by that node, so its original spelling and line breaks survive.
 * Fields that did not exist in the source go right after the last sibling
 * with the same tag, or at the end.
 */
public final class ChildOrder {

    private final List<Section<Object>> entries;
    private final SList source;
    private final int positional;

    private ChildOrder(List<Section<Object>> entries, SList source, int positional) {
        this.entries = entries;
        this.source = source;
        this.positional = positional;
    }

    public static ChildOrder empty() {
        return new ChildOrder(new ArrayList<>(), null, 0);
    }

    /**
     * Captures the children of {@code source} after the tag and
     * {@code positional} leading values. {@code classifier} maps a child to
     * the key of the field it feeds, or null when the child is not modeled.
     * A key seen twice keeps the later occurrence raw.
     */
    public static ChildOrder capture(SList source, int positional, Function<SNode, Object> classifier) {
        List<Section<Object>> entries = new ArrayList<>();
        Set<Object> seen = new HashSet<>();
        for (int i = 1 + positional; i < source.size(); i++) {
            SNode child = source.get(i);
            Object key = classifier.apply(child);
            if (key != null && seen.add(key)) {
                entries.add(Section.modeled(key, child));
            } else {
                entries.add(Section.unmodeled(child));
            }
        }
        return new ChildOrder(entries, source, positional);
    }

    public List<Section<Object>> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /** The list this order was captured from, or null for elements created in memory. */
    public SList getSource() {
        return source;
    }

    /** Node the field {@code key} was read from, or null. */
    public SNode sourceOf(Object key) {
        for (Section<Object> entry : entries) {
            if (entry instanceof Section.Modeled<Object> modeled && modeled.value().equals(key)) {
                return modeled.source();
            }
        }
        return null;
    }

    /** Subtrees kept verbatim, in source order. */
    public List<SNode> getUnmodeled() {
        List<SNode> raw = new ArrayList<>();
        for (Section<Object> entry : entries) {
            if (entry instanceof Section.Unmodeled<Object> unmodeled) {
                raw.add(unmodeled.node());
            }
        }
        return raw;
    }

    public List<SList> getUnmodeled(String tag) {
        List<SList> raw = new ArrayList<>();
        for (SNode node : getUnmodeled()) {
            if (node instanceof SList list && list.hasTag(tag)) {
                raw.add(list);
            }
        }
        return raw;
    }

    /**
     * Appends the children to {@code builder}, which must already hold the
     * tag and positional values. {@code fields} maps field keys to the nodes
     * to write, in canonical order; a null node omits the field.
     */
    public void emit(SExpressionBuilder builder, Map<Object, SNode> fields) {
        List<SNode> out = new ArrayList<>();
        List<Integer> origins = new ArrayList<>();
        Set<Object> written = new HashSet<>();

        for (int e = 0; e < entries.size(); e++) {
            Section<Object> entry = entries.get(e);
            int sourceIndex = 1 + positional + e;
            if (entry instanceof Section.Modeled<Object> modeled) {
                Object key = modeled.value();
                if (!fields.containsKey(key) || !written.add(key)) {
                    continue;
                }
                SNode node = fields.get(key);
                if (node != null) {
                    out.add(node.equals(modeled.source()) ? modeled.source() : node);
                    origins.add(sourceIndex);
                }
            } else if (entry instanceof Section.Unmodeled<Object> unmodeled) {
                out.add(unmodeled.node());
                origins.add(sourceIndex);
            }
        }

        for (Map.Entry<Object, SNode> field : fields.entrySet()) {
            SNode node = field.getValue();
            if (node != null && !written.contains(field.getKey())) {
                int at = insertionPoint(out, node);
                out.add(at, node);
                origins.add(at, -1);
            }
        }

        int lead = builder.size();
        builder.addChildren(out);
        builder.layout(layoutFor(lead, out, origins));
    }

    private static int insertionPoint(List<SNode> out, SNode node) {
        String tag = nameOf(node);
        for (int i = out.size() - 1; i >= 0 && tag != null; i--) {
            if (tag.equals(nameOf(out.get(i)))) {
                return i + 1;
            }
        }
        return out.size();
    }

    private static String nameOf(SNode node) {
        if (node instanceof SList list) {
            return list.tag();
        }
        return node instanceof SSymbol symbol ? symbol.value() : null;
    }

    /**
     * Line breaks of the source for every child that came from it; new list
     * children start on their own line when the source was multi-line.
     */
    private ListLayout layoutFor(int lead, List<SNode> out, List<Integer> origins) {
        if (source == null || source.layout() == null || lead != 1 + positional) {
            return null;
        }
        ListLayout sourceLayout = source.layout();
        boolean multiLine = sourceLayout.breaksBeforeClose() > 0;
        List<Integer> breaks = new ArrayList<>();
        for (int i = 0; i < lead; i++) {
            breaks.add(sourceLayout.breaksBefore(i));
        }
        for (int k = 0; k < out.size(); k++) {
            int origin = origins.get(k);
            if (origin >= 0) {
                breaks.add(sourceLayout.breaksBefore(origin));
            } else {
                breaks.add(multiLine && out.get(k) instanceof SList ? 1 : 0);
            }
        }
        return new ListLayout(breaks, sourceLayout.breaksBeforeClose());
    }
}
