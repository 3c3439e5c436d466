package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.fidelity.AtomStyle;
import nl.bytesoflife.deltakicad.fidelity.FieldCodec;
import nl.bytesoflife.deltakicad.fidelity.FlagStyle;
import nl.bytesoflife.deltakicad.model.pcb.Board;
import nl.bytesoflife.deltakicad.model.pcb.Footprint;
import nl.bytesoflife.deltakicad.model.pcb.Net;
import nl.bytesoflife.deltakicad.model.pcb.Track;
import nl.bytesoflife.deltakicad.sexpr.SExpressionBuilder;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.LinkedHashMap;
import java.util.Map;

/** Writes {@code .kicad_pcb} boards. */
public class BoardWriter extends DocumentWriter<Board> {

    @Override
    public SList toTree(Board board) {
        Map<Object, SNode> fields = new LinkedHashMap<>();
        CommonMapping.putHeader(fields, board);
        fields.put("general", generalNode(board));
        for (Net net : board.getNets()) {
            fields.put(net, SExpressionBuilder.create("net")
                    .addValue(net.number())
                    .addValue(net.name())
                    .build());
        }
        for (Footprint footprint : board.getFootprints()) {
            fields.put(footprint, FootprintMapping.footprintNode(footprint, false));
        }
        for (Track track : board.getTracks()) {
            fields.put(track, trackNode(track));
        }

        SExpressionBuilder b = SExpressionBuilder.create(Board.TOKEN);
        board.getChildOrder().emit(b, fields);
        return b.build();
    }

    private static SList generalNode(Board board) {
        SNode thickness = FieldCodec.coordNode("thickness", board.getThicknessField());
        if (thickness == null && board.getGeneralOrder().getSource() == null) {
            return null;
        }
        Map<Object, SNode> fields = new LinkedHashMap<>();
        fields.put("thickness", thickness);
        SExpressionBuilder b = SExpressionBuilder.create("general");
        board.getGeneralOrder().emit(b, fields);
        return b.build();
    }

    static SList trackNode(Track track) {
        Map<Object, SNode> fields = new LinkedHashMap<>();
        fields.put("locked", FieldCodec.flagNode("locked", track.getLockedField(), FlagStyle.CHILD_NODE));
        fields.put("start", CommonMapping.pointNode("start", track.getStart()));
        fields.put("end", CommonMapping.pointNode("end", track.getEnd()));
        if (track.getWidth() != null) {
            fields.put("width", SExpressionBuilder.create("width").addMm(track.getWidth()).build());
        }
        fields.put("layer", FieldCodec.textNode("layer", track.getLayerField(), AtomStyle.STRING));
        if (track.getNet() != null) {
            fields.put("net", SExpressionBuilder.create("net").addValue(track.getNet().longValue()).build());
        }
        fields.put("uuid", FieldCodec.uuidNode(track.getUuidField()));

        SExpressionBuilder b = SExpressionBuilder.create("segment");
        track.getChildOrder().emit(b, fields);
        return b.build();
    }
}
