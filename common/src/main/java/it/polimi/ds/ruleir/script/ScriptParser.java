package it.polimi.ds.ruleir.script;

import it.polimi.ds.ruleir.tree.*;
import org.jspecify.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive-descent parser for the predicate language.
 * <p>
 * Expressions are parsed completely. Statements which the rule analysis gives no meaning to are parsed leniently:
 * simple ones are kept as a {@link KeywordStatementTree}, block ones as a {@link CompoundStatementTree} holding only
 * the statements of their clauses, so that whole rule files can be parsed and searched.
 */
public final class ScriptParser {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue", "def",
            "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");
    private static final Set<String> SKIPPED_SIMPLE_STATEMENTS = Set.of(
            "import", "from", "pass", "break", "continue", "global", "nonlocal", "raise", "assert", "del", "yield");
    private static final Set<String> SKIPPED_COMPOUND_STATEMENTS = Set.of("for", "while", "with", "try", "class");
    private static final Set<String> CONTINUATION_CLAUSES = Set.of("else", "except", "finally", "elif");
    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private final List<Token> tokens;
    private int current = 0;

    private ScriptParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a whole module.
     *
     * @param source text to parse
     * @return the module tree
     * @throws ScriptSyntaxException if the text is not valid
     */
    public static ModuleTree parse(String source) throws ScriptSyntaxException {
        return new ScriptParser(Lexer.tokenize(source)).module();
    }

    /**
     * Parses a single expression, optionally surrounded by blank lines.
     *
     * @param source text to parse
     * @return the expression tree
     * @throws ScriptSyntaxException if the text is not exactly one valid expression
     */
    public static ExpressionTree parseExpression(String source) throws ScriptSyntaxException {
        final var parser = new ScriptParser(Lexer.tokenize(source));
        final ExpressionTree expression = parser.testListStarExpr();
        parser.skipNewlines();
        if (!parser.check(TokenType.END))
            throw parser.error(parser.peek(), "Unexpected " + describe(parser.peek()) + " after expression");
        return expression;
    }

    private ModuleTree module() throws ScriptSyntaxException {
        final Token start = peek();
        final List<StatementTree> body = new ArrayList<>();
        while (!check(TokenType.END)) {
            if (match(TokenType.NEWLINE))
                continue;
            body.addAll(statement());
        }
        return new ModuleTree(body, body.isEmpty() ? start.span() : start.span().to(previous().span()));
    }

    // Statements

    private List<StatementTree> statement() throws ScriptSyntaxException {
        final Token tok = peek();
        if (tok.type() == TokenType.INDENT)
            throw error(tok, "Unexpected indent");
        if (tok.isOperator("@"))
            return List.of(decorated());
        if (tok.isKeyword("def") || (tok.isKeyword("async") && peek(1).isKeyword("def")))
            return List.of(functionDef());
        if (tok.isKeyword("if"))
            return List.of(ifStatement());
        if (tok.isKeyword("async") || SKIPPED_COMPOUND_STATEMENTS.contains(keywordOf(tok)))
            return List.of(compoundStatement());
        return simpleStatements();
    }

    private StatementTree decorated() throws ScriptSyntaxException {
        while (matchOp("@")) {
            testListStarExpr();
            expect(TokenType.NEWLINE, "Expected newline after decorator");
        }

        final Token tok = peek();
        if (tok.isKeyword("def") || (tok.isKeyword("async") && peek(1).isKeyword("def")))
            return functionDef();
        if (tok.isKeyword("class"))
            return compoundStatement();
        throw error(tok, "Expected function or class definition after decorator");
    }

    private FunctionDefTree functionDef() throws ScriptSyntaxException {
        final Token start = peek();
        matchKeyword("async");
        expectKeyword("def");
        final String name = expect(TokenType.NAME, "Expected function name").text();
        expectOp("(", "Expected '(' after function name");
        final List<ParameterTree> parameters = parameters(")", true);
        expectOp(")", "Expected ')' after parameters");
        if (matchOp("->"))
            test();
        expectOp(":", "Expected ':' after function signature");
        final List<StatementTree> body = suite();
        return new FunctionDefTree(name, parameters, body, spanFrom(start));
    }

    private List<ParameterTree> parameters(String closer, boolean allowAnnotations) throws ScriptSyntaxException {
        final List<ParameterTree> parameters = new ArrayList<>();
        while (!checkOp(closer)) {
            final Token start = peek();
            if (matchOp("/")) {
                // Positional-only marker
            } else if (matchOp("*")) {
                if (!checkOp(",") && !checkOp(closer)) {
                    final String name = expect(TokenType.NAME, "Expected parameter name").text();
                    if (allowAnnotations && matchOp(":"))
                        test();
                    parameters.add(new ParameterTree(name, ParameterTree.Type.VAR_POSITIONAL, null, spanFrom(start)));
                }
            } else if (matchOp("**")) {
                final String name = expect(TokenType.NAME, "Expected parameter name").text();
                if (allowAnnotations && matchOp(":"))
                    test();
                parameters.add(new ParameterTree(name, ParameterTree.Type.VAR_KEYWORD, null, spanFrom(start)));
            } else {
                final Token nameTok = expect(TokenType.NAME, "Expected parameter name");
                if (KEYWORDS.contains(nameTok.text()))
                    throw error(nameTok, "Keyword '" + nameTok.text() + "' cannot be a parameter name");
                if (allowAnnotations && matchOp(":"))
                    test();
                final ExpressionTree defaultValue = matchOp("=") ? test() : null;
                parameters.add(new ParameterTree(nameTok.text(), ParameterTree.Type.PLAIN, defaultValue, spanFrom(start)));
            }

            if (!matchOp(","))
                break;
        }
        return parameters;
    }

    private IfTree ifStatement() throws ScriptSyntaxException {
        final Token start = advance();
        final ExpressionTree condition = test();
        expectOp(":", "Expected ':' after if condition");
        final List<StatementTree> body = suite();

        final List<StatementTree> orElse;
        if (checkKeyword("elif"))
            orElse = List.of(ifStatement());
        else if (matchKeyword("else")) {
            expectOp(":", "Expected ':' after else");
            orElse = suite();
        } else {
            orElse = List.of();
        }
        return new IfTree(condition, body, orElse, spanFrom(start));
    }

    private CompoundStatementTree compoundStatement() throws ScriptSyntaxException {
        final Token start = peek();
        matchKeyword("async");
        final String keyword = advance().text();

        final List<StatementTree> body = new ArrayList<>(clause());
        while (CONTINUATION_CLAUSES.contains(keywordOf(peek())) && !keyword.equals("class")) {
            advance();
            body.addAll(clause());
        }
        return new CompoundStatementTree(keyword, body, spanFrom(start));
    }

    private List<StatementTree> clause() throws ScriptSyntaxException {
        // Header tokens are not interpreted, brackets never hold the header's own ':'
        int depth = 0;
        while (depth > 0 || !checkOp(":")) {
            final Token tok = advance();
            if (tok.type() == TokenType.END || tok.type() == TokenType.NEWLINE)
                throw error(tok, "Expected ':' to end the block header");
            if (tok.isOperator("(") || tok.isOperator("[") || tok.isOperator("{"))
                depth++;
            else if (tok.isOperator(")") || tok.isOperator("]") || tok.isOperator("}"))
                depth--;
        }
        expectOp(":", "Expected ':'");
        return suite();
    }

    private List<StatementTree> suite() throws ScriptSyntaxException {
        if (!match(TokenType.NEWLINE))
            return simpleStatements();

        expect(TokenType.INDENT, "Expected an indented block");
        final List<StatementTree> body = new ArrayList<>();
        while (!match(TokenType.DEDENT)) {
            if (check(TokenType.END))
                throw error(peek(), "Unexpected end of input inside block");
            if (match(TokenType.NEWLINE))
                continue;
            body.addAll(statement());
        }
        return body;
    }

    private List<StatementTree> simpleStatements() throws ScriptSyntaxException {
        final List<StatementTree> statements = new ArrayList<>();
        do {
            statements.add(simpleStatement());
        } while (matchOp(";") && !check(TokenType.NEWLINE) && !check(TokenType.END));

        if (!match(TokenType.NEWLINE) && !check(TokenType.END))
            throw error(peek(), "Unexpected " + describe(peek()));
        return statements;
    }

    private StatementTree simpleStatement() throws ScriptSyntaxException {
        final Token start = peek();
        if (matchKeyword("return")) {
            final ExpressionTree value = isStatementEnd() ? null : testListStarExpr();
            return new ReturnTree(value, spanFrom(start));
        }

        if (SKIPPED_SIMPLE_STATEMENTS.contains(keywordOf(start))) {
            while (!isStatementEnd())
                advance();
            return new KeywordStatementTree(start.text(), spanFrom(start));
        }

        final ExpressionTree first = testListStarExpr();
        if (matchOp(":")) {
            test();
            if (!matchOp("="))
                return new KeywordStatementTree("annotation", spanFrom(start));
            return new AssignmentTree(List.of(first), null, testListStarExpr(), spanFrom(start));
        }

        final Token opTok = peek();
        if (opTok.type() == TokenType.OPERATOR
                && opTok.text().length() >= 2
                && opTok.text().endsWith("=")
                && !COMPARISON_OPERATORS.contains(opTok.text())) {
            final BinaryTree.Operator op = BinaryTree.Operator.fromSymbol(
                    opTok.text().substring(0, opTok.text().length() - 1));
            if (op != null) {
                advance();
                return new AssignmentTree(List.of(first), op, testListStarExpr(), spanFrom(start));
            }
        }

        if (checkOp("=")) {
            final List<ExpressionTree> targets = new ArrayList<>();
            ExpressionTree value = first;
            while (matchOp("=")) {
                targets.add(value);
                value = testListStarExpr();
            }
            return new AssignmentTree(targets, null, value, spanFrom(start));
        }

        return new ExpressionStatementTree(first, spanFrom(start));
    }

    private boolean isStatementEnd() {
        return check(TokenType.NEWLINE) || check(TokenType.END) || checkOp(";");
    }

    // Expressions

    private ExpressionTree testListStarExpr() throws ScriptSyntaxException {
        final Token start = peek();
        final ExpressionTree first = testOrStar();
        if (!checkOp(","))
            return first;

        final List<ExpressionTree> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (isTupleEnd())
                break;
            elements.add(testOrStar());
        }
        return new CollectionLiteralTree(CollectionLiteralTree.Type.TUPLE, elements, spanFrom(start));
    }

    private boolean isTupleEnd() {
        final Token tok = peek();
        if (tok.type() == TokenType.NEWLINE || tok.type() == TokenType.END)
            return true;
        if (tok.type() != TokenType.OPERATOR)
            return tok.isKeyword("in");
        return switch (tok.text()) {
            case "=", ")", "]", "}", ":", ";" -> true;
            default -> tok.text().endsWith("=") && !COMPARISON_OPERATORS.contains(tok.text());
        };
    }

    private ExpressionTree testOrStar() throws ScriptSyntaxException {
        final Token start = peek();
        if (matchOp("*"))
            return new StarredTree(bitOr(), spanFrom(start));
        return test();
    }

    private ExpressionTree test() throws ScriptSyntaxException {
        if (checkKeyword("lambda"))
            return lambda();

        final Token start = peek();
        final ExpressionTree body = orTest();
        if (!matchKeyword("if"))
            return body;

        final ExpressionTree condition = orTest();
        expectKeyword("else");
        final ExpressionTree orElse = test();
        return new ConditionalExpressionTree(condition, body, orElse, spanFrom(start));
    }

    private LambdaTree lambda() throws ScriptSyntaxException {
        final Token start = advance();
        final List<ParameterTree> parameters = parameters(":", false);
        expectOp(":", "Expected ':' after lambda parameters");
        final ExpressionTree body = test();
        return new LambdaTree(parameters, body, spanFrom(start));
    }

    private ExpressionTree orTest() throws ScriptSyntaxException {
        final Token start = peek();
        final ExpressionTree first = andTest();
        if (!checkKeyword("or"))
            return first;

        final List<ExpressionTree> values = new ArrayList<>();
        values.add(first);
        while (matchKeyword("or"))
            values.add(andTest());
        return new BoolOpTree(BoolOpTree.Operator.OR, values, spanFrom(start));
    }

    private ExpressionTree andTest() throws ScriptSyntaxException {
        final Token start = peek();
        final ExpressionTree first = notTest();
        if (!checkKeyword("and"))
            return first;

        final List<ExpressionTree> values = new ArrayList<>();
        values.add(first);
        while (matchKeyword("and"))
            values.add(notTest());
        return new BoolOpTree(BoolOpTree.Operator.AND, values, spanFrom(start));
    }

    private ExpressionTree notTest() throws ScriptSyntaxException {
        final Token start = peek();
        if (matchKeyword("not"))
            return new UnaryTree(UnaryTree.Operator.NOT, notTest(), spanFrom(start));
        return comparison();
    }

    private ExpressionTree comparison() throws ScriptSyntaxException {
        final Token start = peek();
        final ExpressionTree left = bitOr();

        final List<CompareTree.Operator> operators = new ArrayList<>();
        final List<ExpressionTree> comparators = new ArrayList<>();
        CompareTree.Operator op;
        while ((op = comparisonOperator()) != null) {
            operators.add(op);
            comparators.add(bitOr());
        }

        if (operators.isEmpty())
            return left;
        return new CompareTree(left, operators, comparators, spanFrom(start));
    }

    private CompareTree.@Nullable Operator comparisonOperator() throws ScriptSyntaxException {
        final Token tok = peek();
        if (tok.type() == TokenType.OPERATOR) {
            final CompareTree.Operator op = switch (tok.text()) {
                case "==" -> CompareTree.Operator.EQ;
                case "!=" -> CompareTree.Operator.NOT_EQ;
                case "<" -> CompareTree.Operator.LT;
                case "<=" -> CompareTree.Operator.LT_E;
                case ">" -> CompareTree.Operator.GT;
                case ">=" -> CompareTree.Operator.GT_E;
                default -> null;
            };
            if (op != null)
                advance();
            return op;
        }

        if (matchKeyword("in"))
            return CompareTree.Operator.IN;
        if (matchKeyword("is"))
            return matchKeyword("not") ? CompareTree.Operator.IS_NOT : CompareTree.Operator.IS;
        if (tok.isKeyword("not") && peek(1).isKeyword("in")) {
            advance();
            advance();
            return CompareTree.Operator.NOT_IN;
        }
        return null;
    }

    private ExpressionTree bitOr() throws ScriptSyntaxException {
        final Token start = peek();
        ExpressionTree left = bitXor();
        while (matchOp("|"))
            left = new BinaryTree(left, BinaryTree.Operator.BIT_OR, bitXor(), spanFrom(start));
        return left;
    }

    private ExpressionTree bitXor() throws ScriptSyntaxException {
        final Token start = peek();
        ExpressionTree left = bitAnd();
        while (matchOp("^"))
            left = new BinaryTree(left, BinaryTree.Operator.BIT_XOR, bitAnd(), spanFrom(start));
        return left;
    }

    private ExpressionTree bitAnd() throws ScriptSyntaxException {
        final Token start = peek();
        ExpressionTree left = shift();
        while (matchOp("&"))
            left = new BinaryTree(left, BinaryTree.Operator.BIT_AND, shift(), spanFrom(start));
        return left;
    }

    private ExpressionTree shift() throws ScriptSyntaxException {
        final Token start = peek();
        ExpressionTree left = arith();
        while (checkOp("<<") || checkOp(">>")) {
            final BinaryTree.Operator op = BinaryTree.Operator.fromSymbol(advance().text());
            left = new BinaryTree(left, op, arith(), spanFrom(start));
        }
        return left;
    }

    private ExpressionTree arith() throws ScriptSyntaxException {
        final Token start = peek();
        ExpressionTree left = term();
        while (checkOp("+") || checkOp("-")) {
            final BinaryTree.Operator op = BinaryTree.Operator.fromSymbol(advance().text());
            left = new BinaryTree(left, op, term(), spanFrom(start));
        }
        return left;
    }

    private ExpressionTree term() throws ScriptSyntaxException {
        final Token start = peek();
        ExpressionTree left = factor();
        while (checkOp("*") || checkOp("/") || checkOp("//") || checkOp("%") || checkOp("@")) {
            final BinaryTree.Operator op = BinaryTree.Operator.fromSymbol(advance().text());
            left = new BinaryTree(left, op, factor(), spanFrom(start));
        }
        return left;
    }

    private ExpressionTree factor() throws ScriptSyntaxException {
        final Token start = peek();
        if (checkOp("-") && peek(1).type() == TokenType.NUMBER && !peek(2).isOperator("**")
                && !peek(2).isOperator(".") && !peek(2).isOperator("[") && !peek(2).isOperator("(")) {
            // Negative number literals are folded right away
            advance();
            final Token number = advance();
            return new LiteralTree(negate((Number) number.value()), spanFrom(start));
        }

        if (matchOp("-"))
            return new UnaryTree(UnaryTree.Operator.NEGATE, factor(), spanFrom(start));
        if (matchOp("+"))
            return new UnaryTree(UnaryTree.Operator.PLUS, factor(), spanFrom(start));
        if (matchOp("~"))
            return new UnaryTree(UnaryTree.Operator.INVERT, factor(), spanFrom(start));
        return power();
    }

    private static Number negate(@Nullable Number value) {
        if (value instanceof Double d)
            return -d;
        if (value instanceof Integer i && i != Integer.MIN_VALUE)
            return -i;
        if (value instanceof Long l)
            return Lexer.narrow(BigInteger.valueOf(l).negate());
        if (value instanceof BigInteger b)
            return Lexer.narrow(b.negate());
        throw new IllegalStateException("Unexpected number literal " + value);
    }

    private ExpressionTree power() throws ScriptSyntaxException {
        final Token start = peek();
        if (matchKeyword("await"))
            throw error(start, "'await' is not supported");

        final ExpressionTree base = primary();
        if (matchOp("**"))
            return new BinaryTree(base, BinaryTree.Operator.POW, factor(), spanFrom(start));
        return base;
    }

    private ExpressionTree primary() throws ScriptSyntaxException {
        final Token start = peek();
        ExpressionTree expr = atom();
        while (true) {
            if (matchOp(".")) {
                final String name = expect(TokenType.NAME, "Expected attribute name after '.'").text();
                expr = new AttributeTree(expr, name, spanFrom(start));
            } else if (matchOp("(")) {
                expr = call(expr, start);
            } else if (matchOp("[")) {
                final ExpressionTree index = subscriptList();
                expectOp("]", "Expected ']' after subscript");
                expr = new SubscriptTree(expr, index, spanFrom(start));
            } else {
                return expr;
            }
        }
    }

    private CallTree call(ExpressionTree function, Token start) throws ScriptSyntaxException {
        final List<ExpressionTree> arguments = new ArrayList<>();
        final List<KeywordTree> keywords = new ArrayList<>();
        while (!checkOp(")")) {
            final Token argStart = peek();
            if (matchOp("*")) {
                arguments.add(new StarredTree(test(), spanFrom(argStart)));
            } else if (matchOp("**")) {
                keywords.add(new KeywordTree(null, test(), spanFrom(argStart)));
            } else if (argStart.type() == TokenType.NAME && peek(1).isOperator("=")) {
                advance();
                advance();
                keywords.add(new KeywordTree(argStart.text(), test(), spanFrom(argStart)));
            } else {
                ExpressionTree arg = test();
                if (checkKeyword("for") || (checkKeyword("async") && peek(1).isKeyword("for"))) {
                    final List<ComprehensionTree> generators = comprehensionClauses();
                    arg = new ComprehensionExpressionTree(
                            ComprehensionExpressionTree.Type.GENERATOR, arg, null, generators, spanFrom(argStart));
                }
                arguments.add(arg);
            }

            if (!matchOp(","))
                break;
        }
        expectOp(")", "Expected ')' after call arguments");
        return new CallTree(function, arguments, keywords, spanFrom(start));
    }

    private ExpressionTree subscriptList() throws ScriptSyntaxException {
        final Token start = peek();
        final ExpressionTree first = subscriptItem();
        if (!checkOp(","))
            return first;

        final List<ExpressionTree> items = new ArrayList<>();
        items.add(first);
        while (matchOp(",")) {
            if (checkOp("]"))
                break;
            items.add(subscriptItem());
        }
        return new CollectionLiteralTree(CollectionLiteralTree.Type.TUPLE, items, spanFrom(start));
    }

    private ExpressionTree subscriptItem() throws ScriptSyntaxException {
        final Token start = peek();
        final ExpressionTree lower = checkOp(":") ? null : test();
        if (!matchOp(":"))
            return Objects.requireNonNull(lower);

        final ExpressionTree upper = checkOp(":") || checkOp("]") || checkOp(",") ? null : test();
        ExpressionTree step = null;
        if (matchOp(":") && !checkOp("]") && !checkOp(","))
            step = test();
        return new SliceTree(lower, upper, step, spanFrom(start));
    }

    private ExpressionTree atom() throws ScriptSyntaxException {
        final Token start = peek();
        switch (start.type()) {
            case NUMBER -> {
                advance();
                return new LiteralTree(start.value(), start.span());
            }
            case STRING -> {
                final StringBuilder sb = new StringBuilder();
                while (check(TokenType.STRING))
                    sb.append((String) advance().value());
                return new LiteralTree(sb.toString(), spanFrom(start));
            }
            case NAME -> {
                advance();
                return switch (start.text()) {
                    case "True" -> new LiteralTree(Boolean.TRUE, start.span());
                    case "False" -> new LiteralTree(Boolean.FALSE, start.span());
                    case "None" -> new LiteralTree(null, start.span());
                    default -> {
                        if (KEYWORDS.contains(start.text()))
                            throw error(start, "Unexpected keyword '" + start.text() + "'");
                        yield new NameTree(start.text(), start.span());
                    }
                };
            }
            case OPERATOR -> {
                switch (start.text()) {
                    case "(" -> {
                        return parenthesized();
                    }
                    case "[" -> {
                        return listDisplay();
                    }
                    case "{" -> {
                        return braceDisplay();
                    }
                    case "..." -> {
                        advance();
                        return new NameTree("Ellipsis", start.span());
                    }
                    default -> throw error(start, "Unexpected " + describe(start));
                }
            }
            default -> throw error(start, "Unexpected " + describe(start));
        }
    }

    private ExpressionTree parenthesized() throws ScriptSyntaxException {
        final Token start = advance();
        if (matchOp(")"))
            return new CollectionLiteralTree(CollectionLiteralTree.Type.TUPLE, List.of(), spanFrom(start));
        if (checkKeyword("yield"))
            throw error(peek(), "'yield' expressions are not supported");

        final ExpressionTree first = testOrStar();
        if (checkKeyword("for") || (checkKeyword("async") && peek(1).isKeyword("for"))) {
            final List<ComprehensionTree> generators = comprehensionClauses();
            expectOp(")", "Expected ')' after generator expression");
            return new ComprehensionExpressionTree(
                    ComprehensionExpressionTree.Type.GENERATOR, first, null, generators, spanFrom(start));
        }

        if (matchOp(")"))
            return first;

        final List<ExpressionTree> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkOp(")"))
                break;
            elements.add(testOrStar());
        }
        expectOp(")", "Expected ')'");
        return new CollectionLiteralTree(CollectionLiteralTree.Type.TUPLE, elements, spanFrom(start));
    }

    private ExpressionTree listDisplay() throws ScriptSyntaxException {
        final Token start = advance();
        if (matchOp("]"))
            return new CollectionLiteralTree(CollectionLiteralTree.Type.LIST, List.of(), spanFrom(start));

        final ExpressionTree first = testOrStar();
        if (checkKeyword("for") || (checkKeyword("async") && peek(1).isKeyword("for"))) {
            final List<ComprehensionTree> generators = comprehensionClauses();
            expectOp("]", "Expected ']' after list comprehension");
            return new ComprehensionExpressionTree(
                    ComprehensionExpressionTree.Type.LIST, first, null, generators, spanFrom(start));
        }

        final List<ExpressionTree> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkOp("]"))
                break;
            elements.add(testOrStar());
        }
        expectOp("]", "Expected ']'");
        return new CollectionLiteralTree(CollectionLiteralTree.Type.LIST, elements, spanFrom(start));
    }

    private ExpressionTree braceDisplay() throws ScriptSyntaxException {
        final Token start = advance();
        if (matchOp("}"))
            return new DictTree(List.of(), List.of(), spanFrom(start));

        if (checkOp("**"))
            return dictDisplay(start, null, null);

        final ExpressionTree first = testOrStar();
        if (matchOp(":")) {
            final ExpressionTree value = test();
            if (checkKeyword("for") || (checkKeyword("async") && peek(1).isKeyword("for"))) {
                final List<ComprehensionTree> generators = comprehensionClauses();
                expectOp("}", "Expected '}' after dict comprehension");
                return new ComprehensionExpressionTree(
                        ComprehensionExpressionTree.Type.DICT, first, value, generators, spanFrom(start));
            }
            return dictDisplay(start, first, value);
        }

        if (checkKeyword("for") || (checkKeyword("async") && peek(1).isKeyword("for"))) {
            final List<ComprehensionTree> generators = comprehensionClauses();
            expectOp("}", "Expected '}' after set comprehension");
            return new ComprehensionExpressionTree(
                    ComprehensionExpressionTree.Type.SET, first, null, generators, spanFrom(start));
        }

        final List<ExpressionTree> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkOp("}"))
                break;
            elements.add(testOrStar());
        }
        expectOp("}", "Expected '}'");
        return new CollectionLiteralTree(CollectionLiteralTree.Type.SET, elements, spanFrom(start));
    }

    private DictTree dictDisplay(Token start,
                                 @Nullable ExpressionTree firstKey,
                                 @Nullable ExpressionTree firstValue) throws ScriptSyntaxException {
        final List<@Nullable ExpressionTree> keys = new ArrayList<>();
        final List<ExpressionTree> values = new ArrayList<>();
        if (firstValue != null) {
            keys.add(firstKey);
            values.add(firstValue);
            if (!matchOp(",")) {
                expectOp("}", "Expected '}'");
                return new DictTree(keys, values, spanFrom(start));
            }
        }

        while (!checkOp("}")) {
            if (matchOp("**")) {
                keys.add(null);
                values.add(bitOr());
            } else {
                keys.add(test());
                expectOp(":", "Expected ':' in dict entry");
                values.add(test());
            }

            if (!matchOp(","))
                break;
        }
        expectOp("}", "Expected '}'");
        return new DictTree(keys, values, spanFrom(start));
    }

    private List<ComprehensionTree> comprehensionClauses() throws ScriptSyntaxException {
        final List<ComprehensionTree> generators = new ArrayList<>();
        while (checkKeyword("for") || (checkKeyword("async") && peek(1).isKeyword("for"))) {
            final Token start = peek();
            matchKeyword("async");
            expectKeyword("for");
            final ExpressionTree target = targetList();
            expectKeyword("in");
            final ExpressionTree iterator = orTest();

            final List<ExpressionTree> conditions = new ArrayList<>();
            while (matchKeyword("if"))
                conditions.add(orTest());
            generators.add(new ComprehensionTree(target, iterator, conditions, spanFrom(start)));
        }
        return generators;
    }

    private ExpressionTree targetList() throws ScriptSyntaxException {
        final Token start = peek();
        final ExpressionTree first = targetItem();
        if (!checkOp(","))
            return first;

        final List<ExpressionTree> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkKeyword("in"))
                break;
            elements.add(targetItem());
        }
        return new CollectionLiteralTree(CollectionLiteralTree.Type.TUPLE, elements, spanFrom(start));
    }

    private ExpressionTree targetItem() throws ScriptSyntaxException {
        final Token start = peek();
        if (matchOp("*"))
            return new StarredTree(bitOr(), spanFrom(start));
        return bitOr();
    }

    // Token helpers

    private void skipNewlines() {
        while (check(TokenType.NEWLINE))
            advance();
    }

    private Token peek() {
        return peek(0);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(current + ahead, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token advance() {
        final Token tok = peek();
        if (tok.type() != TokenType.END)
            current++;
        return tok;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkOp(String op) {
        return peek().isOperator(op);
    }

    private boolean checkKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    private boolean match(TokenType type) {
        if (!check(type))
            return false;
        advance();
        return true;
    }

    private boolean matchOp(String op) {
        if (!checkOp(op))
            return false;
        advance();
        return true;
    }

    private boolean matchKeyword(String keyword) {
        if (!checkKeyword(keyword))
            return false;
        advance();
        return true;
    }

    private Token expect(TokenType type, String message) throws ScriptSyntaxException {
        if (!check(type))
            throw error(peek(), message + ", found " + describe(peek()));
        return advance();
    }

    private void expectOp(String op, String message) throws ScriptSyntaxException {
        if (!matchOp(op))
            throw error(peek(), message + ", found " + describe(peek()));
    }

    private void expectKeyword(String keyword) throws ScriptSyntaxException {
        if (!matchKeyword(keyword))
            throw error(peek(), "Expected '" + keyword + "', found " + describe(peek()));
    }

    private Span spanFrom(Token start) {
        return start.span().to(previous().span());
    }

    private static String keywordOf(Token tok) {
        return tok.type() == TokenType.NAME && KEYWORDS.contains(tok.text()) ? tok.text() : "";
    }

    private static String describe(Token tok) {
        return switch (tok.type()) {
            case END -> "end of input";
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            default -> "'" + tok.text() + "'";
        };
    }

    private ScriptSyntaxException error(Token tok, String message) {
        return new ScriptSyntaxException(message, tok.span().line(), tok.span().column());
    }
}
