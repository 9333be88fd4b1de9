package com.sqlshaper.model;

import java.util.List;

/**
 * Comment-carrying capability shared by every query and value node.
 *
 * <p>A node carries two kinds of comments: free-form header comments
 * ({@link #getComments()}), used for comments preceding a statement or comments that
 * could not be tied to a specific position, and positioned comments rendered
 * immediately before or after the node.
 */
public interface SqlNode {

    /**
     * Returns the free-form comments in attachment order.
     */
    List<String> getComments();

    void addComment(String comment);

    /**
     * Attaches comments at a position, merging with comments already there.
     *
     * <p>An empty list is ignored.
     *
     * @param position before or after the node
     * @param comments the comment bodies
     */
    void addPositionedComments(CommentPosition position, List<String> comments);

    /**
     * Returns the comments attached at one position, empty if none.
     */
    List<String> getPositionedComments(CommentPosition position);

    /**
     * Returns all positioned comments: every {@code BEFORE} comment in attachment
     * order followed by every {@code AFTER} comment.
     */
    List<String> getAllPositionedComments();

    /**
     * Returns the raw positioned comment groups in attachment order.
     */
    List<PositionedComment> getPositionedCommentGroups();
}
