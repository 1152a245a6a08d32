package it.polimi.ds.ruleir.analyzer.source;

import it.polimi.ds.ruleir.tree.LambdaTree;
import it.polimi.ds.ruleir.tree.Tree;
import it.polimi.ds.ruleir.tree.TreeScanner;
import org.jspecify.annotations.Nullable;

/**
 * Finds the first lambda, in source order, starting at a given line.
 */
final class LambdaLineFinder extends TreeScanner<Integer> {

    private @Nullable LambdaTree found;

    private LambdaLineFinder() {
    }

    static @Nullable LambdaTree find(Tree tree, int line) {
        final LambdaLineFinder finder = new LambdaLineFinder();
        finder.scan(tree, line);
        return finder.found;
    }

    @Override
    public @Nullable Void visitLambda(LambdaTree node, Integer line) {
        if (found != null)
            return null;

        if (node.getStartLine() == line) {
            found = node;
            return null;
        }
        return super.visitLambda(node, line);
    }
}
