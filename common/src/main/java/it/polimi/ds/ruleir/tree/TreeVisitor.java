package it.polimi.ds.ruleir.tree;

public interface TreeVisitor<R, P> {

    R visitModule(ModuleTree node, P p);

    R visitFunctionDef(FunctionDefTree node, P p);

    R visitParameter(ParameterTree node, P p);

    R visitReturn(ReturnTree node, P p);

    R visitIf(IfTree node, P p);

    R visitExpressionStatement(ExpressionStatementTree node, P p);

    R visitAssignment(AssignmentTree node, P p);

    R visitCompoundStatement(CompoundStatementTree node, P p);

    R visitKeywordStatement(KeywordStatementTree node, P p);

    R visitLambda(LambdaTree node, P p);

    R visitBoolOp(BoolOpTree node, P p);

    R visitUnary(UnaryTree node, P p);

    R visitCompare(CompareTree node, P p);

    R visitConditionalExpression(ConditionalExpressionTree node, P p);

    R visitBinary(BinaryTree node, P p);

    R visitCall(CallTree node, P p);

    R visitKeyword(KeywordTree node, P p);

    R visitStarred(StarredTree node, P p);

    R visitAttribute(AttributeTree node, P p);

    R visitSubscript(SubscriptTree node, P p);

    R visitSlice(SliceTree node, P p);

    R visitName(NameTree node, P p);

    R visitLiteral(LiteralTree node, P p);

    R visitCollectionLiteral(CollectionLiteralTree node, P p);

    R visitDict(DictTree node, P p);

    R visitComprehensionExpression(ComprehensionExpressionTree node, P p);

    R visitComprehension(ComprehensionTree node, P p);
}
