package com.formshift.core.layout;

import com.formshift.core.layout.ControlGeometry.Point;
import com.formshift.core.model.ControlNode;
import com.formshift.core.model.PropertyValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlGeometryTest {

    @Test
    @DisplayName("parsePoint accepts constructor and bare forms")
    void parsePoint() {
        assertEquals(new Point(12, 34), ControlGeometry.parsePoint("new Point(12, 34)"));
        assertEquals(new Point(12, 34), ControlGeometry.parsePoint("new System.Drawing.Point(12, 34)"));
        assertEquals(new Point(5, 6), ControlGeometry.parsePoint("5, 6"));
        assertEquals(new Point(0, 0), ControlGeometry.parsePoint("garbage"));
    }

    @Test
    @DisplayName("dockEdge is empty for undocked and None")
    void dockEdge() {
        var top = new ControlNode("Panel", "p").setProperty("Dock", PropertyValue.opaque("DockStyle.Top"));
        var none = new ControlNode("Panel", "q").setProperty("Dock", PropertyValue.opaque("DockStyle.NONE"));
        assertEquals("Top", ControlGeometry.dockEdge(top).orElseThrow());
        assertTrue(ControlGeometry.dockEdge(none).isEmpty());
        assertTrue(ControlGeometry.dockEdge(new ControlNode("Panel", "r")).isEmpty());
    }

    @Test
    @DisplayName("nearestLine picks the closest line index")
    void nearestLine() {
        var lines = List.of(10, 40, 70);
        assertEquals(0, ControlGeometry.nearestLine(12, lines));
        assertEquals(1, ControlGeometry.nearestLine(44, lines));
        assertEquals(2, ControlGeometry.nearestLine(200, lines));
        assertEquals(0, ControlGeometry.nearestLine(5, List.of()));
    }
}
