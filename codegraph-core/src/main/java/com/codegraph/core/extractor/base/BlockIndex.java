package com.codegraph.core.extractor.base;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Brace-delimited declarations of a file, used to find the innermost declaration that
 * encloses an offset.
 */
public final class BlockIndex {

    /**
     * One declaration with a body.
     *
     * @param localId local id of the declared entity
     * @param qualifiedName qualified name of the entity
     * @param typeLike true for classes, structs, protocols and similar containers
     * @param declarationStart offset of the declaration keyword
     * @param bodyStart offset of the opening brace
     * @param bodyEnd offset of the closing brace (or end of text)
     */
    public record Block(
        int localId,
        String qualifiedName,
        boolean typeLike,
        int declarationStart,
        int bodyStart,
        int bodyEnd
    ) {
        public boolean containsBody(int offset) {
            return offset > bodyStart && offset < bodyEnd;
        }
    }

    private final List<Block> blocks = new ArrayList<>();

    public void add(Block block) {
        blocks.add(block);
    }

    public List<Block> blocks() {
        return List.copyOf(blocks);
    }

    /**
     * Finds the innermost block whose body contains the offset.
     *
     * @param offset character offset
     * @return innermost enclosing block, or empty at file level
     */
    public Optional<Block> innermost(int offset) {
        return blocks.stream()
            .filter(block -> block.containsBody(offset))
            .min(Comparator.comparingInt(block -> block.bodyEnd() - block.bodyStart()));
    }

    /**
     * Finds the innermost block whose body contains the offset and that satisfies a condition.
     *
     * @param offset character offset
     * @param condition block filter, e.g. {@link Block#typeLike()}
     * @return innermost matching block
     */
    public Optional<Block> innermost(int offset, Predicate<Block> condition) {
        return blocks.stream()
            .filter(block -> block.containsBody(offset))
            .filter(condition)
            .min(Comparator.comparingInt(block -> block.bodyEnd() - block.bodyStart()));
    }
}
