package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.fidelity.ConsumedNodes;
import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.fidelity.FieldCodec;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.pcb.Board;
import nl.bytesoflife.deltakicad.model.pcb.Footprint;
import nl.bytesoflife.deltakicad.model.pcb.Net;
import nl.bytesoflife.deltakicad.model.pcb.Track;
import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.List;

/** Reads {@code .kicad_pcb} boards. */
public class BoardReader extends DocumentReader<Board> {

    @Override
    protected String kind() {
        return "board";
    }

    @Override
    protected boolean acceptsRoot(String tag) {
        return Board.TOKEN.equals(tag);
    }

    @Override
    protected Board map(SList root, List<Diagnostic> diagnostics) {
        Board board = new Board();
        ConsumedNodes consumed = new ConsumedNodes();
        CommonMapping.readHeader(root, board, consumed);

        SList general = consumed.mark(root.child("general"), "general");
        if (general != null) {
            ConsumedNodes generalConsumed = new ConsumedNodes();
            board.setThicknessField(generalConsumed.mark(FieldCodec.readCoord(general, "thickness", null), "thickness"));
            board.setGeneralOrder(generalConsumed.capture(general, 0));
        } else {
            board.setThicknessField(EncodedValue.absent(null));
        }

        for (SNode child : root.children()) {
            if (!(child instanceof SList list)) {
                continue;
            }
            if (list.hasTag("net")) {
                Net net = readNet(list);
                if (net != null) {
                    consumed.mark(list, net);
                    board.addNet(net);
                } else {
                    diagnostics.add(Diagnostic.warning("Malformed net declaration kept unmodeled: " + list, null));
                }
            } else if (FootprintMapping.isFootprint(list)) {
                Footprint footprint = FootprintMapping.readFootprint(list, false, diagnostics);
                consumed.mark(list, footprint);
                board.addFootprint(footprint);
            } else if (list.hasTag("segment")) {
                Track track = readTrack(list, diagnostics);
                if (track != null) {
                    consumed.mark(list, track);
                    board.addTrack(track);
                }
            }
        }

        board.setChildOrder(consumed.capture(root, 0));
        return board;
    }

    private static Net readNet(SList node) {
        Integer number = node.getInt(0);
        String name = node.getString(1);
        if (number == null || number < 0 || name == null || node.size() != 3) {
            return null;
        }
        return new Net(number, name);
    }

    static Track readTrack(SList node, List<Diagnostic> diagnostics) {
        CoordPoint start = CommonMapping.readPoint(node.child("start"));
        CoordPoint end = CommonMapping.readPoint(node.child("end"));
        if (start == null || end == null) {
            diagnostics.add(Diagnostic.warning("Segment without start and end kept unmodeled: " + node, null));
            return null;
        }
        Track track = new Track();
        ConsumedNodes consumed = new ConsumedNodes();
        consumed.mark(node.child("start"), "start");
        consumed.mark(node.child("end"), "end");
        track.setStart(start);
        track.setEnd(end);

        SList width = node.child("width");
        if (width != null && width.getCoord(0) != null) {
            consumed.mark(width, "width");
            track.setWidth(width.getCoord(0));
        } else {
            diagnostics.add(Diagnostic.error("Segment has no width: " + node, null));
        }

        track.setLayerField(consumed.mark(FieldCodec.readText(node, "layer"), "layer"));
        SList net = node.child("net");
        if (net != null && net.getInt(0) != null && net.size() == 2) {
            consumed.mark(net, "net");
            track.setNet(net.getInt(0));
        }
        track.setLockedField(consumed.mark(FieldCodec.readFlag(node, "locked"), "locked"));
        track.setUuidField(consumed.mark(FieldCodec.readUuid(node), "uuid"));
        track.setChildOrder(consumed.capture(node, 0));
        return track;
    }
}
