package org.braceform.engine.store;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Ordered, doubly linked sequence of chunks for one formatting run.
 * <p>
 * Chunks live in an arena and are addressed by the stable integer id the store assigns on
 * insertion. The {@code prev}/{@code next}/{@code paired} relations are kept as parallel int
 * lists indexed by id, so a chunk never holds a reference to another chunk and neighbour
 * lookup, insertion, removal and pair lookup are all O(1).
 * <p>
 * The store does not compute nesting levels; callers that insert structural chunks stamp
 * them through {@link org.braceform.engine.frontend.annotate.StructuralAnnotator}.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe. A store is owned by exactly one
 * formatting run.
 */
public final class ChunkStore implements Iterable<Chunk> {

    private static final int NIL = -1;

    private final ObjectArrayList<Chunk> arena = new ObjectArrayList<>();
    private final IntArrayList next = new IntArrayList();
    private final IntArrayList prev = new IntArrayList();
    private final IntArrayList paired = new IntArrayList();
    private final IntArrayList linked = new IntArrayList();

    private int head = NIL;
    private int tail = NIL;
    private int size;

    /**
     * Appends a chunk at the end of the stream.
     *
     * @param chunk A chunk that does not belong to any store yet.
     * @return The same chunk, now linked.
     */
    public Chunk append(Chunk chunk) {
        int id = register(chunk);
        if (tail == NIL) {
            head = id;
        } else {
            next.set(tail, id);
            prev.set(id, tail);
        }
        tail = id;
        size++;
        return chunk;
    }

    /**
     * Links {@code chunk} directly after {@code anchor}.
     *
     * @return The inserted chunk.
     */
    public Chunk insertAfter(Chunk anchor, Chunk chunk) {
        int anchorId = requireLinked(anchor);
        int id = register(chunk);
        int after = next.getInt(anchorId);
        prev.set(id, anchorId);
        next.set(id, after);
        next.set(anchorId, id);
        if (after == NIL) {
            tail = id;
        } else {
            prev.set(after, id);
        }
        size++;
        return chunk;
    }

    /**
     * Links {@code chunk} directly before {@code anchor}.
     *
     * @return The inserted chunk.
     */
    public Chunk insertBefore(Chunk anchor, Chunk chunk) {
        int anchorId = requireLinked(anchor);
        int id = register(chunk);
        int before = prev.getInt(anchorId);
        next.set(id, anchorId);
        prev.set(id, before);
        prev.set(anchorId, id);
        if (before == NIL) {
            head = id;
        } else {
            next.set(before, id);
        }
        size++;
        return chunk;
    }

    /**
     * Unlinks a virtual chunk that a pass created and no longer needs. Real chunks are never
     * removed. A pair relation the chunk takes part in is dissolved.
     *
     * @param chunk The virtual chunk to remove.
     * @throws IllegalArgumentException if the chunk is real.
     */
    public void remove(Chunk chunk) {
        int id = requireLinked(chunk);
        if (!chunk.isVirtual()) {
            throw new IllegalArgumentException("Real chunks cannot be removed: " + chunk);
        }
        int before = prev.getInt(id);
        int after = next.getInt(id);
        if (before == NIL) {
            head = after;
        } else {
            next.set(before, after);
        }
        if (after == NIL) {
            tail = before;
        } else {
            prev.set(after, before);
        }
        int partner = paired.getInt(id);
        if (partner != NIL) {
            paired.set(partner, NIL);
            paired.set(id, NIL);
        }
        prev.set(id, NIL);
        next.set(id, NIL);
        linked.set(id, 0);
        size--;
    }

    public Chunk head() {
        return at(head);
    }

    public Chunk tail() {
        return at(tail);
    }

    /** @return The chunk after {@code chunk}, or null at the end of the stream. */
    public Chunk next(Chunk chunk) {
        return at(next.getInt(requireLinked(chunk)));
    }

    /** @return The chunk before {@code chunk}, or null at the start of the stream. */
    public Chunk prev(Chunk chunk) {
        return at(prev.getInt(requireLinked(chunk)));
    }

    /** @return The first non-newline, non-comment chunk at brace level 0, or null. */
    public Chunk firstAtLevel0() {
        for (Chunk c = head(); c != null; c = next(c)) {
            if (c.getLevel() == 0 && !c.isCommentOrNewline()) {
                return c;
            }
        }
        return null;
    }

    /** @return The next chunk that is not a comment, or null. */
    public Chunk nextNc(Chunk chunk) {
        return nextMatching(chunk, c -> !c.isComment());
    }

    /** @return The next chunk that is neither a comment nor a newline, or null. */
    public Chunk nextNcNnl(Chunk chunk) {
        return nextMatching(chunk, c -> !c.isCommentOrNewline());
    }

    /** @return The previous chunk that is neither a comment nor a newline, or null. */
    public Chunk prevNcNnl(Chunk chunk) {
        return prevMatching(chunk, c -> !c.isCommentOrNewline());
    }

    /** @return The first chunk after {@code chunk} accepted by {@code filter}, or null. */
    public Chunk nextMatching(Chunk chunk, Predicate<Chunk> filter) {
        for (Chunk c = next(chunk); c != null; c = next(c)) {
            if (filter.test(c)) {
                return c;
            }
        }
        return null;
    }

    /** @return The first chunk before {@code chunk} accepted by {@code filter}, or null. */
    public Chunk prevMatching(Chunk chunk, Predicate<Chunk> filter) {
        for (Chunk c = prev(chunk); c != null; c = prev(c)) {
            if (filter.test(c)) {
                return c;
            }
        }
        return null;
    }

    /**
     * Records that {@code open} and {@code close} match each other. The relation is
     * structural only; neither chunk owns the other.
     */
    public void pair(Chunk open, Chunk close) {
        int a = requireLinked(open);
        int b = requireLinked(close);
        unpair(open);
        unpair(close);
        paired.set(a, b);
        paired.set(b, a);
    }

    /** Dissolves the pair relation of {@code chunk}, if any. */
    public void unpair(Chunk chunk) {
        int id = requireLinked(chunk);
        int partner = paired.getInt(id);
        if (partner != NIL) {
            paired.set(partner, NIL);
            paired.set(id, NIL);
        }
    }

    /** @return The matching open/close counterpart, or null if none was recorded. */
    public Chunk pairedWith(Chunk chunk) {
        return at(paired.getInt(requireLinked(chunk)));
    }

    /** @return true if the chunk is currently linked into this store. */
    public boolean contains(Chunk chunk) {
        int id = chunk.getId();
        return id >= 0 && id < arena.size() && arena.get(id) == chunk && linked.getInt(id) == 1;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** @return Number of linked chunks of the given type. */
    public int count(ChunkType type) {
        int n = 0;
        for (Chunk c : this) {
            if (c.is(type)) n++;
        }
        return n;
    }

    /**
     * Position of a chunk counted from the head. O(n); meant for diagnostics and tests.
     */
    public int indexOf(Chunk chunk) {
        requireLinked(chunk);
        int i = 0;
        for (Chunk c = head(); c != null; c = next(c), i++) {
            if (c == chunk) {
                return i;
            }
        }
        throw new IllegalStateException("Linked chunk not reachable from head: " + chunk);
    }

    /** @return A snapshot of the stream in order. */
    public List<Chunk> toList() {
        List<Chunk> list = new ArrayList<>(size);
        for (Chunk c : this) {
            list.add(c);
        }
        return list;
    }

    public Stream<Chunk> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Iterates in stream order. The successor is looked up lazily, so chunks inserted after
     * the current position during iteration are visited.
     */
    @Override
    public Iterator<Chunk> iterator() {
        return new Iterator<>() {
            private Chunk current;

            @Override
            public boolean hasNext() {
                return current == null ? head != NIL : ChunkStore.this.next(current) != null;
            }

            @Override
            public Chunk next() {
                Chunk upcoming = current == null ? head() : ChunkStore.this.next(current);
                if (upcoming == null) {
                    throw new NoSuchElementException();
                }
                current = upcoming;
                return current;
            }
        };
    }

    private int register(Chunk chunk) {
        if (chunk == null) {
            throw new IllegalArgumentException("Chunk must not be null");
        }
        int id = arena.size();
        chunk.assignId(id);
        arena.add(chunk);
        next.add(NIL);
        prev.add(NIL);
        paired.add(NIL);
        linked.add(1);
        return id;
    }

    private int requireLinked(Chunk chunk) {
        if (chunk == null) {
            throw new IllegalArgumentException("Chunk handle must not be null");
        }
        if (!contains(chunk)) {
            throw new IllegalArgumentException("Chunk is not linked into this store: " + chunk);
        }
        return chunk.getId();
    }

    private Chunk at(int id) {
        return id == NIL ? null : arena.get(id);
    }
}
