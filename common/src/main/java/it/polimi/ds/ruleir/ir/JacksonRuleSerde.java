package it.polimi.ds.ruleir.ir;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.JsonRecyclerPools;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;

@SuppressWarnings("serial")
public class JacksonRuleSerde implements RuleJsonSerde {

    private final ObjectMapper mapper;

    public JacksonRuleSerde() {
        this(false);
    }

    public JacksonRuleSerde(boolean indent) {
        JsonFactory factory = JsonFactory.builder()
                .recyclerPool(JsonRecyclerPools.sharedLockFreePool())
                .build();
        this.mapper = new ObjectMapper(factory)
                .configure(SerializationFeature.INDENT_OUTPUT, indent)
                .registerModule(new SimpleModule()
                        .addSerializer(RuleNode.class, new RuleNodeSerializer())
                        .addDeserializer(RuleNode.class, new RuleNodeDeserializer()));
    }

    @Override
    public String jsonify(RuleNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write to json", e);
        }
    }

    @Override
    public RuleNode parseJson(String json) {
        try {
            return mapper.readValue(json, RuleNode.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to read json", e);
        }
    }

    private static class RuleNodeSerializer extends StdSerializer<RuleNode> {

        protected RuleNodeSerializer() {
            super(RuleNode.class);
        }

        @Override
        public void serialize(RuleNode value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("type", value.getType().jsonName());
            switch (value.getType()) {
                case CONSTANT -> gen.writeObjectField("value", ((ConstantNode) value).value());
                case NAME -> gen.writeStringField("name", ((NameNode) value).name());
                case ITEM_CHECK -> {
                    var node = (ItemCheckNode) value;
                    gen.writeObjectField("item", node.item());
                    if (node.count() != null)
                        gen.writeObjectField("count", node.count());
                }
                case GROUP_CHECK -> gen.writeObjectField("group", ((GroupCheckNode) value).group());
                case COUNT_CHECK -> {
                    var node = (CountCheckNode) value;
                    gen.writeObjectField("item", node.item());
                    gen.writeObjectField("count", node.count());
                }
                case STATE_METHOD -> {
                    var node = (StateMethodNode) value;
                    gen.writeStringField("method", node.method());
                    gen.writeObjectField("args", node.args());
                }
                case HELPER -> {
                    var node = (HelperNode) value;
                    gen.writeStringField("name", node.name());
                    gen.writeObjectField("args", node.args());
                }
                case AND -> gen.writeObjectField("conditions", ((AndNode) value).conditions());
                case OR -> gen.writeObjectField("conditions", ((OrNode) value).conditions());
                case NOT -> gen.writeObjectField("condition", ((NotNode) value).condition());
                case COMPARE -> {
                    var node = (CompareNode) value;
                    gen.writeObjectField("left", node.left());
                    gen.writeStringField("op", node.op());
                    gen.writeObjectField("right", node.right());
                }
                case CONDITIONAL -> {
                    var node = (ConditionalNode) value;
                    gen.writeObjectField("test", node.test());
                    gen.writeObjectField("if_true", node.ifTrue());
                    gen.writeObjectField("if_false", node.ifFalse());
                }
                case BINARY_OP -> {
                    var node = (BinaryOpNode) value;
                    gen.writeObjectField("left", node.left());
                    gen.writeStringField("op", node.op());
                    gen.writeObjectField("right", node.right());
                }
                case LIST -> gen.writeObjectField("value", ((ListNode) value).value());
                case SUBSCRIPT -> {
                    var node = (SubscriptNode) value;
                    gen.writeObjectField("value", node.value());
                    gen.writeObjectField("index", node.index());
                }
                case ATTRIBUTE -> {
                    var node = (AttributeNode) value;
                    gen.writeObjectField("object", node.object());
                    gen.writeStringField("attr", node.attr());
                }
                case ALL_OF -> {
                    var node = (AllOfNode) value;
                    gen.writeObjectField("element_rule", node.elementRule());
                    gen.writeObjectField("iterator_info", node.iteratorInfo());
                }
                case GENERATOR_EXPRESSION -> {
                    var node = (GeneratorExpressionNode) value;
                    gen.writeObjectField("element", node.element());
                    gen.writeObjectField("comprehension", node.comprehension());
                }
                case COMPREHENSION_DETAILS -> {
                    var node = (ComprehensionDetailsNode) value;
                    gen.writeObjectField("target", node.target());
                    gen.writeObjectField("iterator", node.iterator());
                }
                case FUNCTION_CALL -> {
                    var node = (FunctionCallNode) value;
                    gen.writeObjectField("function", node.function());
                    gen.writeObjectField("args", node.args());
                }
                case ERROR -> {
                    var node = (ErrorNode) value;
                    gen.writeStringField("message", node.message());
                    gen.writeStringField("subtype", node.subtype().jsonName());
                    gen.writeObjectField("debug_log", node.debugLog());
                    gen.writeArrayFieldStart("error_log");
                    for (ErrorLogEntry entry : node.errorLog()) {
                        gen.writeStartObject();
                        gen.writeStringField("message", entry.message());
                        gen.writeStringField("trace", entry.trace());
                        gen.writeEndObject();
                    }
                    gen.writeEndArray();
                    if (node.cleanedSource() != null)
                        gen.writeStringField("cleaned_source", node.cleanedSource());
                    if (node.traceback() != null)
                        gen.writeStringField("traceback", node.traceback());
                }
            }
            gen.writeEndObject();
        }
    }

    private static class RuleNodeDeserializer extends StdDeserializer<RuleNode> {

        protected RuleNodeDeserializer() {
            super(RuleNode.class);
        }

        @Override
        public RuleNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return readNode(p, p.getCodec().readTree(p));
        }

        private static RuleNode readNode(JsonParser p, JsonNode node) throws IOException {
            if (!node.isObject())
                throw JsonMappingException.from(p, "Expected a rule node object, got " + node.getNodeType());

            final String typeName = requireField(p, node, "type").asText();
            final RuleNode.Type type = RuleNode.Type.fromJsonName(typeName);
            if (type == null)
                throw JsonMappingException.from(p, "Unrecognized rule node type " + typeName);

            return switch (type) {
                case CONSTANT -> new ConstantNode(readValue(node.get("value")));
                case NAME -> new NameNode(requireField(p, node, "name").asText());
                case ITEM_CHECK -> new ItemCheckNode(
                        readNode(p, requireField(p, node, "item")),
                        readOptionalNode(p, node.get("count")));
                case GROUP_CHECK -> new GroupCheckNode(readNode(p, requireField(p, node, "group")));
                case COUNT_CHECK -> new CountCheckNode(
                        readNode(p, requireField(p, node, "item")),
                        readNode(p, requireField(p, node, "count")));
                case STATE_METHOD -> new StateMethodNode(
                        requireField(p, node, "method").asText(),
                        readNodes(p, node.get("args")));
                case HELPER -> new HelperNode(
                        requireField(p, node, "name").asText(),
                        readNodes(p, node.get("args")));
                case AND -> new AndNode(readNodes(p, node.get("conditions")));
                case OR -> new OrNode(readNodes(p, node.get("conditions")));
                case NOT -> new NotNode(readNode(p, requireField(p, node, "condition")));
                case COMPARE -> new CompareNode(
                        readNode(p, requireField(p, node, "left")),
                        requireField(p, node, "op").asText(),
                        readNode(p, requireField(p, node, "right")));
                case CONDITIONAL -> new ConditionalNode(
                        readNode(p, requireField(p, node, "test")),
                        readNode(p, requireField(p, node, "if_true")),
                        readOptionalNode(p, node.get("if_false")));
                case BINARY_OP -> new BinaryOpNode(
                        readNode(p, requireField(p, node, "left")),
                        requireField(p, node, "op").asText(),
                        readNode(p, requireField(p, node, "right")));
                case LIST -> new ListNode(readNodes(p, node.get("value")));
                case SUBSCRIPT -> new SubscriptNode(
                        readNode(p, requireField(p, node, "value")),
                        readNode(p, requireField(p, node, "index")));
                case ATTRIBUTE -> new AttributeNode(
                        readNode(p, requireField(p, node, "object")),
                        requireField(p, node, "attr").asText());
                case ALL_OF -> new AllOfNode(
                        readNode(p, requireField(p, node, "element_rule")),
                        readComprehension(p, requireField(p, node, "iterator_info")));
                case GENERATOR_EXPRESSION -> new GeneratorExpressionNode(
                        readNode(p, requireField(p, node, "element")),
                        readComprehension(p, requireField(p, node, "comprehension")));
                case COMPREHENSION_DETAILS -> new ComprehensionDetailsNode(
                        readNode(p, requireField(p, node, "target")),
                        readNode(p, requireField(p, node, "iterator")));
                case FUNCTION_CALL -> new FunctionCallNode(
                        readNode(p, requireField(p, node, "function")),
                        readNodes(p, node.get("args")));
                case ERROR -> readError(p, node);
            };
        }

        private static ErrorNode readError(JsonParser p, JsonNode node) throws IOException {
            final String subtypeName = requireField(p, node, "subtype").asText();
            final ErrorSubtype subtype = ErrorSubtype.fromJsonName(subtypeName);
            if (subtype == null)
                throw JsonMappingException.from(p, "Unrecognized error subtype " + subtypeName);

            final List<String> debugLog = new ArrayList<>();
            final JsonNode debugLogNode = node.get("debug_log");
            if (debugLogNode != null)
                debugLogNode.forEach(e -> debugLog.add(e.asText()));

            final List<ErrorLogEntry> errorLog = new ArrayList<>();
            final JsonNode errorLogNode = node.get("error_log");
            if (errorLogNode != null) {
                for (JsonNode entry : errorLogNode)
                    errorLog.add(new ErrorLogEntry(
                            requireField(p, entry, "message").asText(),
                            readOptionalText(entry.get("trace"))));
            }

            return new ErrorNode(
                    requireField(p, node, "message").asText(),
                    subtype,
                    debugLog,
                    errorLog,
                    readOptionalText(node.get("cleaned_source")),
                    readOptionalText(node.get("traceback")));
        }

        private static ComprehensionDetailsNode readComprehension(JsonParser p, JsonNode node) throws IOException {
            if (readNode(p, node) instanceof ComprehensionDetailsNode details)
                return details;
            throw JsonMappingException.from(p, "Expected a comprehension_details node, got " + node);
        }

        private static @Nullable RuleNode readOptionalNode(JsonParser p, @Nullable JsonNode node) throws IOException {
            return node == null || node.isNull() ? null : readNode(p, node);
        }

        private static List<RuleNode> readNodes(JsonParser p, @Nullable JsonNode node) throws IOException {
            if (node == null || node.isNull())
                return List.of();
            if (!node.isArray())
                throw JsonMappingException.from(p, "Expected an array of rule nodes, got " + node.getNodeType());

            final List<RuleNode> nodes = new ArrayList<>(node.size());
            for (JsonNode element : node)
                nodes.add(readNode(p, element));
            return nodes;
        }

        private static @Nullable String readOptionalText(@Nullable JsonNode node) {
            return node == null || node.isNull() ? null : node.asText();
        }

        private static JsonNode requireField(JsonParser p, JsonNode node, String field) throws IOException {
            final JsonNode value = node.get(field);
            if (value == null)
                throw JsonMappingException.from(p, "Missing field '" + field + "' in " + node);
            return value;
        }

        private static @Nullable Object readValue(@Nullable JsonNode node) throws IOException {
            if (node == null)
                return null;

            return switch (node.getNodeType()) {
                case STRING -> node.textValue();
                case NUMBER -> node.isFloatingPointNumber() ? (Object) node.doubleValue() : node.numberValue();
                case BOOLEAN -> node.asBoolean();
                case MISSING, NULL -> null;
                case BINARY -> Base64.getEncoder().encodeToString(node.binaryValue());
                case ARRAY -> {
                    var list = new ArrayList<@Nullable Object>(node.size());
                    for (Iterator<JsonNode> it = node.elements(); it.hasNext(); )
                        list.add(readValue(it.next()));
                    yield list;
                }
                case OBJECT -> {
                    var map = new LinkedHashMap<String, @Nullable Object>();
                    for (var it = node.fields(); it.hasNext(); ) {
                        var e = it.next();
                        map.put(e.getKey(), readValue(e.getValue()));
                    }
                    yield map;
                }
                case POJO -> throw new AssertionError("Jackson node of type POJO in a parsed tree " + node);
            };
        }
    }
}
