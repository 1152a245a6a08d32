package it.polimi.ds.ruleir.script;

public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OPERATOR,
    NEWLINE,
    INDENT,
    DEDENT,
    END
}
