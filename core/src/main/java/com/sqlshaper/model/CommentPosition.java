package com.sqlshaper.model;

/**
 * Where a positioned comment renders relative to the node it is attached to.
 */
public enum CommentPosition {
    BEFORE,
    AFTER
}
