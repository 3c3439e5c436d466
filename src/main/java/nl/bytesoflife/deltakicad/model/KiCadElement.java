package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.fidelity.ChildOrder;
import nl.bytesoflife.deltakicad.sexpr.SNode;

import java.util.List;

/**
 * Base for every modeled list element. Keeps the order of the children the
 * element was read from, including the ones that are not modeled, so writing
 * puts everything back where it was.
 */
public abstract class KiCadElement {

    private ChildOrder childOrder = ChildOrder.empty();

    public ChildOrder getChildOrder() {
        return childOrder;
    }

    public void setChildOrder(ChildOrder childOrder) {
        this.childOrder = childOrder != null ? childOrder : ChildOrder.empty();
    }

    /** Children kept verbatim because they are not modeled. */
    public List<SNode> getUnmodeled() {
        return childOrder.getUnmodeled();
    }
}
