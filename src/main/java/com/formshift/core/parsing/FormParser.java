package com.formshift.core.parsing;

import java.nio.file.Path;

/**
 * Turns one form source file into a control tree.
 * Implementations report problems in the returned {@link ParseResult} instead of throwing.
 */
public interface FormParser {

    ParseResult parse(Path file);
}
