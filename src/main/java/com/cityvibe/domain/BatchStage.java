package com.cityvibe.domain;

/**
 * Pipeline stage a per-record error originated from
 */
public enum BatchStage {
    NORMALIZE,
    VALIDATE,
    DEDUPLICATE,
    ENRICH,
    PERSIST
}
