package com.formshift.core.engine;

import com.formshift.core.model.ConversionProgress;

@FunctionalInterface
public interface ProgressObserver {

    ProgressObserver NONE = progress -> { };

    void onProgress(ConversionProgress progress);
}
