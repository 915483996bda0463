package com.formshift.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A node in a parsed form's control tree.
 * <p>
 * A node owns its children; the parent reference is a non-owning back-link used only
 * for upward lookups. {@link #addChild(ControlNode)} keeps the tree acyclic and sibling
 * names unique. Property, event and binding lookups never fail for unknown names:
 * callers get an empty {@link Optional} and decide whether to skip.
 */
public class ControlNode {

    private final String kind;
    private final String name;
    private final String sourceFile;
    private final Integer sourceLine;
    private final Map<String, PropertyValue> properties = new LinkedHashMap<>();
    private final Map<String, String> events = new LinkedHashMap<>();
    private final List<DataBinding> dataBindings = new ArrayList<>();
    private final List<ControlNode> children = new ArrayList<>();
    private ControlNode parent;

    public ControlNode(String kind, String name) {
        this(kind, name, null, null);
    }

    public ControlNode(String kind, String name, String sourceFile, Integer sourceLine) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
        this.sourceFile = sourceFile;
        this.sourceLine = sourceLine;
    }

    public String kind() { return kind; }
    public String name() { return name; }
    public Optional<String> sourceFile() { return Optional.ofNullable(sourceFile); }
    public Optional<Integer> sourceLine() { return Optional.ofNullable(sourceLine); }

    // -- Properties, events, bindings --

    public ControlNode setProperty(String propertyName, PropertyValue value) {
        properties.put(propertyName, Objects.requireNonNull(value, "value"));
        return this;
    }

    public Optional<PropertyValue> property(String propertyName) {
        return Optional.ofNullable(properties.get(propertyName));
    }

    public boolean hasProperty(String propertyName) {
        return properties.containsKey(propertyName);
    }

    public Map<String, PropertyValue> properties() {
        return Collections.unmodifiableMap(properties);
    }

    public ControlNode addEvent(String eventName, String handler) {
        events.put(eventName, handler);
        return this;
    }

    public Map<String, String> events() {
        return Collections.unmodifiableMap(events);
    }

    public ControlNode addDataBinding(DataBinding binding) {
        dataBindings.add(Objects.requireNonNull(binding, "binding"));
        return this;
    }

    public List<DataBinding> dataBindings() {
        return Collections.unmodifiableList(dataBindings);
    }

    // -- Structure --

    /**
     * Attaches {@code child} as the last child of this node. A child that already has a
     * parent is detached from it first.
     *
     * @throws IllegalArgumentException if the child is this node or one of its ancestors,
     *                                  or a different sibling already uses the child's name
     */
    public ControlNode addChild(ControlNode child) {
        Objects.requireNonNull(child, "child");
        for (ControlNode n = this; n != null; n = n.parent) {
            if (n == child) {
                throw new IllegalArgumentException(
                        "Attaching '" + child.name + "' under '" + name + "' would create a cycle");
            }
        }
        if (child.parent == this) {
            return this;
        }
        if (findChild(child.name).isPresent()) {
            throw new IllegalArgumentException(
                    "'" + name + "' already has a child named '" + child.name + "'");
        }
        if (child.parent != null) {
            child.parent.removeChild(child);
        }
        children.add(child);
        child.parent = this;
        return this;
    }

    /**
     * Detaches {@code child} from this node.
     *
     * @return {@code true} if the child was attached here
     */
    public boolean removeChild(ControlNode child) {
        if (child == null || child.parent != this) {
            return false;
        }
        children.remove(child);
        child.parent = null;
        return true;
    }

    public List<ControlNode> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public Optional<ControlNode> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean isRoot() {
        return parent == null;
    }

    public ControlNode root() {
        ControlNode n = this;
        while (n.parent != null) {
            n = n.parent;
        }
        return n;
    }

    public Optional<ControlNode> findChild(String childName) {
        for (ControlNode c : children) {
            if (c.name.equals(childName)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public Optional<ControlNode> findDescendant(String descendantName) {
        return depthFirst().stream()
                .filter(n -> n != this && n.name.equals(descendantName))
                .findFirst();
    }

    /** Pre-order traversal starting at (and including) this node. */
    public List<ControlNode> depthFirst() {
        var result = new ArrayList<ControlNode>();
        Deque<ControlNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            ControlNode n = stack.pop();
            result.add(n);
            for (int i = n.children.size() - 1; i >= 0; i--) {
                stack.push(n.children.get(i));
            }
        }
        return result;
    }

    /** Number of nodes in this subtree, this node included. */
    public int subtreeSize() {
        return depthFirst().size();
    }

    @Override
    public String toString() {
        return kind + " " + name + " (" + children.size() + " children)";
    }
}
