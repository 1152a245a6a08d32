package it.polimi.ds.ruleir.ir;

import org.jspecify.annotations.Nullable;

import java.util.List;

public sealed interface RuleNode permits
        ConstantNode, NameNode,
        ItemCheckNode, GroupCheckNode, CountCheckNode, StateMethodNode, HelperNode,
        AndNode, OrNode, NotNode, CompareNode, ConditionalNode,
        BinaryOpNode, ListNode, SubscriptNode, AttributeNode,
        AllOfNode, GeneratorExpressionNode, ComprehensionDetailsNode, FunctionCallNode,
        ErrorNode {

    Type getType();

    enum Type {
        CONSTANT("constant"),
        NAME("name"),
        ITEM_CHECK("item_check"),
        GROUP_CHECK("group_check"),
        COUNT_CHECK("count_check"),
        STATE_METHOD("state_method"),
        HELPER("helper"),
        AND("and"),
        OR("or"),
        NOT("not"),
        COMPARE("compare"),
        CONDITIONAL("conditional"),
        BINARY_OP("binary_op"),
        LIST("list"),
        SUBSCRIPT("subscript"),
        ATTRIBUTE("attribute"),
        ALL_OF("all_of"),
        GENERATOR_EXPRESSION("generator_expression"),
        COMPREHENSION_DETAILS("comprehension_details"),
        FUNCTION_CALL("function_call"),
        ERROR("error");

        public static final List<Type> VALUES = List.of(values());

        private final String jsonName;

        Type(String jsonName) {
            this.jsonName = jsonName;
        }

        public String jsonName() {
            return jsonName;
        }

        public static @Nullable Type fromJsonName(String jsonName) {
            for (Type type : VALUES) {
                if (type.jsonName.equals(jsonName))
                    return type;
            }
            return null;
        }
    }
}
