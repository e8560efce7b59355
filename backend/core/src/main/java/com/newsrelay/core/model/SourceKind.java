package com.newsrelay.core.model;

public enum SourceKind {
    RSS,
    HTML
}
