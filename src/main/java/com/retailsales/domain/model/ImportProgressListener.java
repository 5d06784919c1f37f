package com.retailsales.domain.model;

@FunctionalInterface
public interface ImportProgressListener {

    ImportProgressListener NONE = progress -> { };

    void onProgress(ImportProgress progress);
}
