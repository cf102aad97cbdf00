package com.example.bpmn_transformer.util;

import com.example.bpmn_transformer.model.Box;
import com.example.bpmn_transformer.model.Point;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LayoutGeometryTest {

    private final Box box = new Box(100, 100, 100, 80); // center (150, 140)

    @Test
    void anchorsOnRightSideWhenTargetIsMostlyRight() {
        assertEquals(new Point(200, 150), LayoutGeometry.edgeAnchor(box, 400, 150));
    }

    @Test
    void anchorsOnLeftSideAndClampsVertically() {
        // far left and well below: |dx| = 250 > |dy| = 160
        assertEquals(new Point(100, 180), LayoutGeometry.edgeAnchor(box, -100, 300));
    }

    @Test
    void anchorsOnTopOrBottomWhenVerticalDominates() {
        assertEquals(new Point(160, 100), LayoutGeometry.edgeAnchor(box, 160, -50));
        assertEquals(new Point(200, 180), LayoutGeometry.edgeAnchor(box, 260, 400));
    }

    @Test
    void tieGoesHorizontal() {
        // dx = dy = 50
        assertEquals(new Point(200, 180), LayoutGeometry.edgeAnchor(box, 200, 190));
    }

    @Test
    void groupAndNoteAnchorFacingSides() {
        Box group = new Box(76, 76, 598, 128);
        Box note = new Box(76, 28, 160, 40);

        assertEquals(new Point(76, 76), LayoutGeometry.edgeAnchor(group, note));
        assertEquals(new Point(236, 68), LayoutGeometry.edgeAnchor(note, group));
    }

    @Test
    void enclosingBoxPadsUnionAndUsesPlaceholder() {
        Map<String, Box> known = Map.of(
                "A", new Box(100, 100, 100, 80),
                "B", new Box(400, 250, 100, 80));
        Box placeholder = new Box(100, 100, 100, 80);

        assertEquals(new Box(76, 76, 448, 278),
                LayoutGeometry.enclosingBox(List.of("A", "B"), known::get, placeholder, 24));
        assertEquals(new Box(76, 76, 148, 128),
                LayoutGeometry.enclosingBox(List.of("X"), known::get, placeholder, 24));
        assertThrows(IllegalArgumentException.class,
                () -> LayoutGeometry.enclosingBox(List.of(), known::get, placeholder, 24));
    }

    @Test
    void forwardConnectorRunsRightMiddleToLeftMiddle() {
        Point[] pts = LayoutGeometry.forwardConnector(new Box(100, 100, 100, 80), new Box(550, 100, 100, 80));
        assertEquals(new Point(200, 140), pts[0]);
        assertEquals(new Point(550, 140), pts[1]);
    }

    @Test
    void clamp() {
        assertEquals(5.0, LayoutGeometry.clamp(5, 0, 10));
        assertEquals(0.0, LayoutGeometry.clamp(-3, 0, 10));
        assertEquals(10.0, LayoutGeometry.clamp(42, 0, 10));
    }
}
