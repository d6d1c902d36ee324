package com.example.magazinetoc.model;

public enum EntryKind {
    SECTION_HEADING,
    ITEM
}
