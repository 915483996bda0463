package com.formshift.core.generator;

import com.formshift.core.model.ControlNode;
import com.formshift.core.model.LayoutAnalysisResult;

import java.util.List;

/**
 * Produces text artifacts for one parsed form. Implementations are Spring beans; the
 * conversion engine runs all of them, in order, for every form.
 */
public interface ArtifactEmitter {

    List<GeneratedArtifact> emit(ControlNode root, LayoutAnalysisResult layout, NamingContext naming);
}
