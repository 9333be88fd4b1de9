package com.sqlshaper.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A group of comments attached at one position of a node.
 *
 * @param position before or after the node
 * @param comments comment bodies in attachment order
 */
public record PositionedComment(CommentPosition position, List<String> comments) {

    public PositionedComment {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(comments, "comments must not be null");
        comments = Collections.unmodifiableList(new ArrayList<>(comments));
    }

    /**
     * Returns a new group with {@code more} appended after the existing comments.
     */
    PositionedComment merge(List<String> more) {
        List<String> merged = new ArrayList<>(comments);
        merged.addAll(more);
        return new PositionedComment(position, merged);
    }
}
