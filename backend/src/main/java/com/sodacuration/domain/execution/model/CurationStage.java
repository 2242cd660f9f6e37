package com.sodacuration.domain.execution.model;

public enum CurationStage {
    EXTRACT_SECTIONS,
    EXTRACT_INDIVIDUAL_CAPTIONS,
    ASSIGN_PANEL_SOURCE,
    MATCH_CAPTION_PANEL,
    EXTRACT_DATA_SOURCES
}
