package com.formshift.core.model;

/**
 * Aggregate counters for a conversion run.
 * <p>
 * Mutable and not thread-safe: the conversion engine mutates it under its own lock and
 * hands out {@link #copy()} snapshots to observers.
 */
public class ConversionStatistics {

    private int totalForms;
    private int convertedForms;
    private int failedForms;
    private int upToDateForms;
    private int totalControls;
    private int convertedControls;
    private int placeholderControls;
    private int totalProperties;
    private int mappedProperties;
    private int unmappedProperties;
    private int totalEvents;
    private int convertedToCommands;
    private int filesGenerated;
    private int checkpointsSaved;
    private int rollbacksPerformed;

    public ConversionStatistics copy() {
        var c = new ConversionStatistics();
        c.totalForms = totalForms;
        c.convertedForms = convertedForms;
        c.failedForms = failedForms;
        c.upToDateForms = upToDateForms;
        c.totalControls = totalControls;
        c.convertedControls = convertedControls;
        c.placeholderControls = placeholderControls;
        c.totalProperties = totalProperties;
        c.mappedProperties = mappedProperties;
        c.unmappedProperties = unmappedProperties;
        c.totalEvents = totalEvents;
        c.convertedToCommands = convertedToCommands;
        c.filesGenerated = filesGenerated;
        c.checkpointsSaved = checkpointsSaved;
        c.rollbacksPerformed = rollbacksPerformed;
        return c;
    }

    /** Folds the tallies of one converted form into the totals. */
    public void addForm(FormTally tally) {
        convertedForms++;
        convertedControls += tally.controls() - tally.placeholders();
        placeholderControls += tally.placeholders();
        totalProperties += tally.properties();
        mappedProperties += tally.mappedProperties();
        unmappedProperties += tally.properties() - tally.mappedProperties();
        totalEvents += tally.events();
        convertedToCommands += tally.commands();
    }

    public int getTotalForms() { return totalForms; }
    public void setTotalForms(int totalForms) { this.totalForms = totalForms; }
    public int getConvertedForms() { return convertedForms; }
    public void setConvertedForms(int convertedForms) { this.convertedForms = convertedForms; }
    public int getFailedForms() { return failedForms; }
    public void setFailedForms(int failedForms) { this.failedForms = failedForms; }
    public void incrementFailedForms() { failedForms++; }
    public int getUpToDateForms() { return upToDateForms; }
    public void setUpToDateForms(int upToDateForms) { this.upToDateForms = upToDateForms; }
    public void incrementUpToDateForms() { upToDateForms++; }
    public int getTotalControls() { return totalControls; }
    public void setTotalControls(int totalControls) { this.totalControls = totalControls; }
    public void addTotalControls(int count) { totalControls += count; }
    public int getConvertedControls() { return convertedControls; }
    public void setConvertedControls(int convertedControls) { this.convertedControls = convertedControls; }
    public int getPlaceholderControls() { return placeholderControls; }
    public void setPlaceholderControls(int placeholderControls) { this.placeholderControls = placeholderControls; }
    public int getTotalProperties() { return totalProperties; }
    public void setTotalProperties(int totalProperties) { this.totalProperties = totalProperties; }
    public int getMappedProperties() { return mappedProperties; }
    public void setMappedProperties(int mappedProperties) { this.mappedProperties = mappedProperties; }
    public int getUnmappedProperties() { return unmappedProperties; }
    public void setUnmappedProperties(int unmappedProperties) { this.unmappedProperties = unmappedProperties; }
    public int getTotalEvents() { return totalEvents; }
    public void setTotalEvents(int totalEvents) { this.totalEvents = totalEvents; }
    public int getConvertedToCommands() { return convertedToCommands; }
    public void setConvertedToCommands(int convertedToCommands) { this.convertedToCommands = convertedToCommands; }
    public int getFilesGenerated() { return filesGenerated; }
    public void setFilesGenerated(int filesGenerated) { this.filesGenerated = filesGenerated; }
    public void addFilesGenerated(int count) { filesGenerated += count; }
    public int getCheckpointsSaved() { return checkpointsSaved; }
    public void setCheckpointsSaved(int checkpointsSaved) { this.checkpointsSaved = checkpointsSaved; }
    public void incrementCheckpointsSaved() { checkpointsSaved++; }
    public int getRollbacksPerformed() { return rollbacksPerformed; }
    public void setRollbacksPerformed(int rollbacksPerformed) { this.rollbacksPerformed = rollbacksPerformed; }
    public void incrementRollbacksPerformed() { rollbacksPerformed++; }
}
