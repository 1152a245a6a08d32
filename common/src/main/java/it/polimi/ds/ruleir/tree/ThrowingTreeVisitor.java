package it.polimi.ds.ruleir.tree;

public class ThrowingTreeVisitor<R, P> implements TreeVisitor<R, P> {

    protected R visitUnsupported(Tree node, P p) {
        throw new IllegalStateException("Unsupported tree node " + node.getKind());
    }

    // Everything throws unless overridden

    @Override
    public R visitModule(ModuleTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitFunctionDef(FunctionDefTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitParameter(ParameterTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitReturn(ReturnTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitIf(IfTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitExpressionStatement(ExpressionStatementTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitAssignment(AssignmentTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitCompoundStatement(CompoundStatementTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitKeywordStatement(KeywordStatementTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitLambda(LambdaTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitBoolOp(BoolOpTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitUnary(UnaryTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitCompare(CompareTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitConditionalExpression(ConditionalExpressionTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitBinary(BinaryTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitCall(CallTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitKeyword(KeywordTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitStarred(StarredTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitAttribute(AttributeTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitSubscript(SubscriptTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitSlice(SliceTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitName(NameTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitLiteral(LiteralTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitCollectionLiteral(CollectionLiteralTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitDict(DictTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitComprehensionExpression(ComprehensionExpressionTree node, P p) {
        return visitUnsupported(node, p);
    }

    @Override
    public R visitComprehension(ComprehensionTree node, P p) {
        return visitUnsupported(node, p);
    }
}
