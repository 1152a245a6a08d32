package it.polimi.ds.ruleir.tree;

import org.jspecify.annotations.Nullable;

/**
 * Visitor which walks every child of a tree in source order.
 * <p>
 * Subclasses override the nodes they are interested in and call {@code super} to keep descending.
 */
public class TreeScanner<P> implements TreeVisitor<@Nullable Void, P> {

    public final void scan(@Nullable Tree node, P p) {
        if (node != null)
            node.accept(this, p);
    }

    public final void scan(Iterable<? extends @Nullable Tree> nodes, P p) {
        for (Tree node : nodes)
            scan(node, p);
    }

    @Override
    public @Nullable Void visitModule(ModuleTree node, P p) {
        scan(node.body(), p);
        return null;
    }

    @Override
    public @Nullable Void visitFunctionDef(FunctionDefTree node, P p) {
        scan(node.parameters(), p);
        scan(node.body(), p);
        return null;
    }

    @Override
    public @Nullable Void visitParameter(ParameterTree node, P p) {
        scan(node.defaultValue(), p);
        return null;
    }

    @Override
    public @Nullable Void visitReturn(ReturnTree node, P p) {
        scan(node.value(), p);
        return null;
    }

    @Override
    public @Nullable Void visitIf(IfTree node, P p) {
        scan(node.condition(), p);
        scan(node.body(), p);
        scan(node.orElse(), p);
        return null;
    }

    @Override
    public @Nullable Void visitExpressionStatement(ExpressionStatementTree node, P p) {
        scan(node.expression(), p);
        return null;
    }

    @Override
    public @Nullable Void visitAssignment(AssignmentTree node, P p) {
        scan(node.targets(), p);
        scan(node.value(), p);
        return null;
    }

    @Override
    public @Nullable Void visitCompoundStatement(CompoundStatementTree node, P p) {
        scan(node.body(), p);
        return null;
    }

    @Override
    public @Nullable Void visitKeywordStatement(KeywordStatementTree node, P p) {
        return null;
    }

    @Override
    public @Nullable Void visitLambda(LambdaTree node, P p) {
        scan(node.parameters(), p);
        scan(node.body(), p);
        return null;
    }

    @Override
    public @Nullable Void visitBoolOp(BoolOpTree node, P p) {
        scan(node.values(), p);
        return null;
    }

    @Override
    public @Nullable Void visitUnary(UnaryTree node, P p) {
        scan(node.operand(), p);
        return null;
    }

    @Override
    public @Nullable Void visitCompare(CompareTree node, P p) {
        scan(node.left(), p);
        scan(node.comparators(), p);
        return null;
    }

    @Override
    public @Nullable Void visitConditionalExpression(ConditionalExpressionTree node, P p) {
        scan(node.trueExpression(), p);
        scan(node.condition(), p);
        scan(node.falseExpression(), p);
        return null;
    }

    @Override
    public @Nullable Void visitBinary(BinaryTree node, P p) {
        scan(node.left(), p);
        scan(node.right(), p);
        return null;
    }

    @Override
    public @Nullable Void visitCall(CallTree node, P p) {
        scan(node.function(), p);
        scan(node.arguments(), p);
        scan(node.keywords(), p);
        return null;
    }

    @Override
    public @Nullable Void visitKeyword(KeywordTree node, P p) {
        scan(node.value(), p);
        return null;
    }

    @Override
    public @Nullable Void visitStarred(StarredTree node, P p) {
        scan(node.value(), p);
        return null;
    }

    @Override
    public @Nullable Void visitAttribute(AttributeTree node, P p) {
        scan(node.object(), p);
        return null;
    }

    @Override
    public @Nullable Void visitSubscript(SubscriptTree node, P p) {
        scan(node.object(), p);
        scan(node.index(), p);
        return null;
    }

    @Override
    public @Nullable Void visitSlice(SliceTree node, P p) {
        scan(node.lower(), p);
        scan(node.upper(), p);
        scan(node.step(), p);
        return null;
    }

    @Override
    public @Nullable Void visitName(NameTree node, P p) {
        return null;
    }

    @Override
    public @Nullable Void visitLiteral(LiteralTree node, P p) {
        return null;
    }

    @Override
    public @Nullable Void visitCollectionLiteral(CollectionLiteralTree node, P p) {
        scan(node.elements(), p);
        return null;
    }

    @Override
    public @Nullable Void visitDict(DictTree node, P p) {
        for (int i = 0; i < node.values().size(); i++) {
            scan(node.keys().get(i), p);
            scan(node.values().get(i), p);
        }
        return null;
    }

    @Override
    public @Nullable Void visitComprehensionExpression(ComprehensionExpressionTree node, P p) {
        scan(node.generators(), p);
        scan(node.element(), p);
        scan(node.value(), p);
        return null;
    }

    @Override
    public @Nullable Void visitComprehension(ComprehensionTree node, P p) {
        scan(node.iterator(), p);
        scan(node.target(), p);
        scan(node.conditions(), p);
        return null;
    }
}
