package it.polimi.ds.ruleir.tree;

public interface Tree {

    Kind getKind();

    Span span();

    default int getStartLine() {
        return span().line();
    }

    default int getStartPosition() {
        return span().startPosition();
    }

    default int getEndPosition() {
        return span().endPosition();
    }

    <R, P> R accept(TreeVisitor<R, P> visitor, P p);

    enum Kind {
        MODULE,
        FUNCTION_DEF,
        PARAMETER,
        RETURN,
        IF,
        EXPRESSION_STATEMENT,
        ASSIGNMENT,
        COMPOUND_STATEMENT,
        KEYWORD_STATEMENT,
        LAMBDA,
        BOOL_OP,
        UNARY,
        COMPARE,
        CONDITIONAL_EXPRESSION,
        BINARY,
        CALL,
        KEYWORD,
        STARRED,
        ATTRIBUTE,
        SUBSCRIPT,
        SLICE,
        NAME,
        LITERAL,
        COLLECTION_LITERAL,
        DICT,
        COMPREHENSION_EXPRESSION,
        COMPREHENSION
    }
}
