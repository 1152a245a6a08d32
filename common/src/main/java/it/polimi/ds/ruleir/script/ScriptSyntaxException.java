package it.polimi.ds.ruleir.script;

/**
 * Thrown when text is not valid in the predicate language.
 */
@SuppressWarnings({
        "serial", // Don't care about this being serializable
        "RedundantSuppression" // Javac complains about serial, IntelliJ about the suppression
})
public class ScriptSyntaxException extends Exception {

    private final int line;
    private final int column;

    public ScriptSyntaxException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
