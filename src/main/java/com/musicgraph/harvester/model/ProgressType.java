package com.musicgraph.harvester.model;

/**
 * Progress update types.
 */
public enum ProgressType {
    DISCOVERY,
    DOWNLOAD,
    COMPLETE,
    ERROR
}
