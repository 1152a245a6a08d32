package it.polimi.ds.ruleir.tree;

/**
 * Location of a node in the parsed text.
 *
 * @param line 1-based line of the first character
 * @param column 0-based column of the first character
 * @param startPosition offset of the first character
 * @param endPosition offset after the last character
 */
public record Span(int line, int column, int startPosition, int endPosition) {

    public static final Span NONE = new Span(0, 0, 0, 0);

    public Span to(Span end) {
        return new Span(line, column, startPosition, end.endPosition);
    }
}
