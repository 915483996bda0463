package com.formshift.core.parsing;

import com.formshift.core.model.ControlNode;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of parsing one form source file.
 *
 * @param file        the parsed file
 * @param root        root of the control tree, {@code null} when parsing failed
 * @param allControls every control declared in the file, attached or not
 * @param errors      reasons parsing failed; empty on success
 * @param warnings    statements that were understood but could not be applied
 */
public record ParseResult(
    Path file,
    ControlNode root,
    List<ControlNode> allControls,
    List<String> errors,
    List<String> warnings
) {

    public ParseResult {
        allControls = allControls == null ? List.of() : List.copyOf(allControls);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ParseResult success(Path file, ControlNode root, List<ControlNode> allControls, List<String> warnings) {
        return new ParseResult(file, root, allControls, List.of(), warnings);
    }

    public static ParseResult failure(Path file, String reason) {
        return new ParseResult(file, null, List.of(), List.of(reason), List.of());
    }

    public boolean isSuccess() {
        return root != null && errors.isEmpty();
    }

    public Optional<ControlNode> rootControl() {
        return Optional.ofNullable(root);
    }

    /** All error messages joined for display. */
    public String failureReason() {
        return String.join("; ", errors);
    }
}
