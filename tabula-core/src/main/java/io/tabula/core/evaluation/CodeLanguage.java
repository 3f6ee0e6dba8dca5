package io.tabula.core.evaluation;

public enum CodeLanguage {
    SQL,
    SCRIPT
}
