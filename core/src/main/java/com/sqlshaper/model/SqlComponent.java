package com.sqlshaper.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class holding the comment state of an AST node.
 *
 * <p>Comment state is excluded from {@code equals}/{@code hashCode} of subclasses;
 * two nodes that differ only by comments are structurally equal.
 */
public abstract class SqlComponent implements SqlNode {

    private final List<String> comments = new ArrayList<>();
    private final List<PositionedComment> positionedComments = new ArrayList<>();

    @Override
    public List<String> getComments() {
        return Collections.unmodifiableList(comments);
    }

    @Override
    public void addComment(String comment) {
        Objects.requireNonNull(comment, "comment must not be null");
        comments.add(comment);
    }

    @Override
    public void addPositionedComments(CommentPosition position, List<String> newComments) {
        Objects.requireNonNull(position, "position must not be null");
        if (newComments == null || newComments.isEmpty()) {
            return;
        }
        for (int i = 0; i < positionedComments.size(); i++) {
            PositionedComment existing = positionedComments.get(i);
            if (existing.position() == position) {
                positionedComments.set(i, existing.merge(newComments));
                return;
            }
        }
        positionedComments.add(new PositionedComment(position, newComments));
    }

    @Override
    public List<String> getPositionedComments(CommentPosition position) {
        List<String> result = new ArrayList<>();
        for (PositionedComment group : positionedComments) {
            if (group.position() == position) {
                result.addAll(group.comments());
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public List<String> getAllPositionedComments() {
        List<String> result = new ArrayList<>(getPositionedComments(CommentPosition.BEFORE));
        result.addAll(getPositionedComments(CommentPosition.AFTER));
        return Collections.unmodifiableList(result);
    }

    @Override
    public List<PositionedComment> getPositionedCommentGroups() {
        return Collections.unmodifiableList(positionedComments);
    }
}
