package org.treekit.ast.api;

/**
 * An immutable source-location tag attached to every node.
 * It is produced by the source-map component and only carried around by the tree.
 *
 * @param sourceId  The id of the source file the node was parsed from.
 * @param startByte The byte offset where the node starts (inclusive).
 * @param endByte   The byte offset where the node ends (exclusive).
 */
public record Span(int sourceId, int startByte, int endByte) {

    /** A zero-width span for synthesized nodes that have no source text. */
    public static final Span SYNTHETIC = new Span(0, 0, 0);

    public Span {
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException(
                    String.format("Invalid span bounds [%d-%d]", startByte, endByte));
        }
    }

    /**
     * Creates a span in the given source.
     * @param sourceId  The source id.
     * @param startByte The start offset.
     * @param endByte   The end offset.
     * @return The new span.
     */
    public static Span of(int sourceId, int startByte, int endByte) {
        return new Span(sourceId, startByte, endByte);
    }

    /**
     * @return The number of bytes covered by this span.
     */
    public int length() {
        return endByte - startByte;
    }

    /**
     * Returns the smallest span covering both this span and {@code other}.
     * @param other The span to merge with; must belong to the same source.
     * @return The covering span.
     * @throws IllegalArgumentException if the spans come from different sources.
     */
    public Span merge(Span other) {
        if (other.sourceId != sourceId) {
            throw new IllegalArgumentException(String.format(
                    "Cannot merge spans of different sources: %s and %s", this, other));
        }
        return new Span(sourceId, Math.min(startByte, other.startByte), Math.max(endByte, other.endByte));
    }

    @Override
    public String toString() {
        return sourceId + ":" + startByte + "-" + endByte;
    }
}
