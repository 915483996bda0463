package com.formshift.core.generator;

import com.formshift.core.model.ControlNode;
import com.formshift.core.model.FormTally;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Counts controls, properties and events of a form against the mapping tables.
 */
public final class FormStatistics {

    private FormStatistics() {}

    public static FormTally tally(ControlNode root) {
        int controls = 0;
        int placeholders = 0;
        int properties = 0;
        int mapped = 0;
        int events = 0;
        int commands = 0;
        for (ControlNode node : root.depthFirst()) {
            controls++;
            if (!ControlMappings.isMapped(node.kind())) {
                placeholders++;
            }
            for (String property : node.properties().keySet()) {
                properties++;
                if (PropertyMappings.lookup(property, node.kind()).isPresent()) {
                    mapped++;
                }
            }
            for (Map.Entry<String, String> event : node.events().entrySet()) {
                events++;
                if (EventMappings.isCommand(event.getKey())) {
                    commands++;
                }
            }
        }
        return new FormTally(controls, placeholders, properties, mapped, events, commands);
    }

    /** {@code "Kind name"} for every control without a target mapping. */
    public static List<String> placeholders(ControlNode root) {
        List<String> result = new ArrayList<>();
        for (ControlNode node : root.depthFirst()) {
            if (!ControlMappings.isMapped(node.kind())) {
                result.add(node.kind() + " " + node.name());
            }
        }
        return result;
    }
}
