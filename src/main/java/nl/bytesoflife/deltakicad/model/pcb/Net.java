package nl.bytesoflife.deltakicad.model.pcb;

import java.util.Objects;

/** Board net, declared as {@code (net 1 "GND")} and referenced by pads and tracks. */
public record Net(int number, String name) {

    public static final Net UNCONNECTED = new Net(0, "");

    public Net {
        Objects.requireNonNull(name, "name");
        if (number < 0) {
            throw new IllegalArgumentException("Net number must not be negative: " + number);
        }
    }
}
