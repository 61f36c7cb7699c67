package io.meld.core.model;

/**
 * Where a node came from: 1-based start/end positions and, when the document was parsed with
 * locations, the file path.
 *
 * @param start    first character of the node
 * @param end      last character of the node
 * @param filePath source file, or {@code null} when parsed without locations
 */
public record SourceLocation(Position start, Position end, String filePath) {

    /** A 1-based line/column pair. */
    public record Position(int line, int column) {}

    public static SourceLocation of(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceLocation(new Position(startLine, startColumn), new Position(endLine, endColumn), null);
    }

    /** Copy of this location tagged with the given file path. */
    public SourceLocation withFilePath(String path) {
        return new SourceLocation(start, end, path);
    }

    @Override
    public String toString() {
        String pos = start.line() + ":" + start.column();
        return filePath != null ? filePath + ":" + pos : pos;
    }
}
