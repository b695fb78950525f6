package com.github.rudygunawan.tokencache.model;

/**
 * What a cache key points at. Files and directories have separate TTLs.
 */
public enum EntryKind {
    FILE,
    DIRECTORY
}
