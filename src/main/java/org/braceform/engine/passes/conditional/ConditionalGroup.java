package org.braceform.engine.passes.conditional;

import org.braceform.engine.model.Chunk;

import java.util.ArrayList;
import java.util.List;

/**
 * One matched {@code #if ... (#elif ...)* (#else ...)? #endif} chain.
 *
 * @param directives The directives of the chain in order, {@code #if} first and
 *                   {@code #endif} last.
 */
public record ConditionalGroup(List<Chunk> directives) {

    /**
     * The chunk range between two consecutive directives of a group, both exclusive.
     *
     * @param directive The directive that opens the branch.
     * @param end       The next directive of the same group.
     */
    public record Branch(Chunk directive, Chunk end) {
    }

    public ConditionalGroup {
        directives = List.copyOf(directives);
        if (directives.size() < 2) {
            throw new IllegalArgumentException("A conditional group needs at least #if and #endif");
        }
    }

    /** @return One branch per directive except the closing {@code #endif}. */
    public List<Branch> branches() {
        List<Branch> branches = new ArrayList<>(directives.size() - 1);
        for (int i = 0; i + 1 < directives.size(); i++) {
            branches.add(new Branch(directives.get(i), directives.get(i + 1)));
        }
        return branches;
    }

    public Chunk opening() {
        return directives.get(0);
    }
}
