package io.github.eutro.qdebug.ir;

import java.util.Objects;

/**
 * The body text attached to an instruction, if it had a brace-delimited block whose content
 * was not inlined into the instruction itself.
 */
public final class Block {
    /**
     * The absent block.
     */
    public static final Block NONE = new Block(false, "");

    /**
     * Whether there is a block at all.
     */
    public final boolean valid;
    /**
     * The text between the braces.
     */
    public final String code;

    private Block(boolean valid, String code) {
        this.valid = valid;
        this.code = code;
    }

    public static Block of(String code) {
        return new Block(true, code);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Block block = (Block) o;
        return valid == block.valid && code.equals(block.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(valid, code);
    }

    @Override
    public String toString() {
        return valid ? "{" + code + "}" : "<no block>";
    }
}
