package com.sodacuration.domain.verification.model;

public enum LabelAlphabet {
    ROMAN,
    UPPERCASE,
    LOWERCASE,
    NUMERIC
}
