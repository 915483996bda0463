package com.formshift.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlNodeTest {

    private static ControlNode form() {
        var form = new ControlNode("Form", "MainForm");
        var panel = new ControlNode("Panel", "panel1");
        panel.addChild(new ControlNode("Button", "okButton"));
        panel.addChild(new ControlNode("Button", "cancelButton"));
        form.addChild(panel);
        form.addChild(new ControlNode("Label", "titleLabel"));
        return form;
    }

    // -- Structure ------------------------------------------------------------

    @Nested
    @DisplayName("structure")
    class StructureTests {

        @Test
        @DisplayName("addChild sets the back-reference")
        void addChildSetsParent() {
            var form = new ControlNode("Form", "MainForm");
            var button = new ControlNode("Button", "button1");
            form.addChild(button);

            assertSame(form, button.parent().orElseThrow());
            assertFalse(button.isRoot());
            assertSame(form, button.root());
            assertEquals(List.of(button), form.children());
        }

        @Test
        @DisplayName("attaching a node under itself is rejected")
        void rejectsSelfAttach() {
            var form = new ControlNode("Form", "MainForm");
            assertThrows(IllegalArgumentException.class, () -> form.addChild(form));
        }

        @Test
        @DisplayName("attaching an ancestor under a descendant is rejected")
        void rejectsCycle() {
            var form = form();
            var panel = form.findChild("panel1").orElseThrow();
            var ok = panel.findChild("okButton").orElseThrow();

            assertThrows(IllegalArgumentException.class, () -> ok.addChild(form));
            assertThrows(IllegalArgumentException.class, () -> ok.addChild(panel));
            assertTrue(form.isRoot());
        }

        @Test
        @DisplayName("duplicate sibling names are rejected")
        void rejectsDuplicateSiblingName() {
            var form = new ControlNode("Form", "MainForm");
            form.addChild(new ControlNode("Button", "button1"));

            var ex = assertThrows(IllegalArgumentException.class,
                    () -> form.addChild(new ControlNode("TextBox", "button1")));
            assertTrue(ex.getMessage().contains("button1"));
            assertEquals(1, form.children().size());
        }

        @Test
        @DisplayName("re-parenting detaches from the previous parent first")
        void reparentDetaches() {
            var form = form();
            var panel = form.findChild("panel1").orElseThrow();
            var ok = panel.findChild("okButton").orElseThrow();

            form.addChild(ok);

            assertSame(form, ok.parent().orElseThrow());
            assertTrue(panel.findChild("okButton").isEmpty());
            assertEquals(1, panel.children().size());
            assertEquals(5, form.subtreeSize());
        }

        @Test
        @DisplayName("removeChild clears the back-reference")
        void removeChildClearsParent() {
            var form = form();
            var label = form.findChild("titleLabel").orElseThrow();

            assertTrue(form.removeChild(label));
            assertTrue(label.isRoot());
            assertFalse(form.removeChild(label));
        }

        @Test
        @DisplayName("children list is read-only")
        void childrenAreUnmodifiable() {
            var form = form();
            assertThrows(UnsupportedOperationException.class,
                    () -> form.children().add(new ControlNode("Button", "x")));
        }
    }

    // -- Queries --------------------------------------------------------------

    @Nested
    @DisplayName("queries")
    class QueryTests {

        @Test
        @DisplayName("depthFirst is pre-order and keeps child order")
        void depthFirstOrder() {
            var names = form().depthFirst().stream().map(ControlNode::name).toList();
            assertEquals(List.of("MainForm", "panel1", "okButton", "cancelButton", "titleLabel"), names);
        }

        @Test
        @DisplayName("subtreeSize counts the node itself")
        void subtreeSize() {
            var form = form();
            assertEquals(5, form.subtreeSize());
            assertEquals(3, form.findChild("panel1").orElseThrow().subtreeSize());
            assertEquals(1, new ControlNode("Label", "l").subtreeSize());
        }

        @Test
        @DisplayName("findChild only looks at direct children, findDescendant at the whole subtree")
        void findChildAndDescendant() {
            var form = form();
            assertTrue(form.findChild("okButton").isEmpty());
            assertEquals("Button", form.findDescendant("okButton").orElseThrow().kind());
            assertTrue(form.findDescendant("MainForm").isEmpty());
        }

        @Test
        @DisplayName("unknown properties are absent, never an error")
        void unknownPropertyIsEmpty() {
            var button = new ControlNode("Button", "b")
                    .setProperty("Text", PropertyValue.text("OK"))
                    .addEvent("Click", "b_Click");

            assertTrue(button.property("NoSuchProperty").isEmpty());
            assertEquals("OK", button.property("Text").orElseThrow().raw());
            assertTrue(button.hasProperty("Text"));
            assertEquals("b_Click", button.events().get("Click"));
        }

        @Test
        @DisplayName("source location is optional")
        void sourceLocation() {
            var located = new ControlNode("Button", "b", "Main.Designer.cs", 42);
            assertEquals(42, located.sourceLine().orElseThrow());
            assertTrue(new ControlNode("Button", "c").sourceFile().isEmpty());
        }
    }
}
