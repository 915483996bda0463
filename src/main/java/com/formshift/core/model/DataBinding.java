package com.formshift.core.model;

/**
 * A data binding declared on a control.
 *
 * @param propertyName      bound control property (e.g. "Text")
 * @param dataSource        expression naming the data source
 * @param dataMember        member of the data source being bound
 * @param formatString      optional format string (nullable)
 * @param formattingEnabled whether source formatting applies
 */
public record DataBinding(
    String propertyName,
    String dataSource,
    String dataMember,
    String formatString,
    boolean formattingEnabled
) {}
