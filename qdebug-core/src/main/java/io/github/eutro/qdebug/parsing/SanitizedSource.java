package io.github.eutro.qdebug.parsing;

import java.util.Collections;
import java.util.List;

/**
 * The result of {@link Sanitizer#sanitize(String, int) sanitizing} a piece of program text.
 */
public final class SanitizedSource {
    /**
     * The text with comments blanked out. Same length as the input.
     */
    public final String commentFree;
    /**
     * The comment-free text with every top-level block removed.
     */
    public final String text;
    /**
     * The removed blocks, in order.
     */
    public final List<SourceBlock> blocks;
    /**
     * Maps offsets in {@link #text} to offsets in the original program text.
     */
    public final SourceMap map;

    SanitizedSource(String commentFree, String text, List<SourceBlock> blocks, SourceMap map) {
        this.commentFree = commentFree;
        this.text = text;
        this.blocks = Collections.unmodifiableList(blocks);
        this.map = map;
    }

    /**
     * Put the blocks back where they were removed, giving the comment-free text again.
     *
     * @return The reconstructed text.
     */
    public String reinsertBlocks() {
        StringBuilder sb = new StringBuilder(commentFree.length());
        int copied = 0;
        for (SourceBlock block : blocks) {
            sb.append(text, copied, block.position).append(block.literal());
            copied = block.position;
        }
        sb.append(text, copied, text.length());
        return sb.toString();
    }
}
