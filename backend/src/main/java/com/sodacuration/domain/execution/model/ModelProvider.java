package com.sodacuration.domain.execution.model;

public enum ModelProvider {
    OPENAI,
    ANTHROPIC
}
