package com.svparser.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.deser.BeanDeserializerModifier;
import com.fasterxml.jackson.databind.deser.ResolvableDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.svparser.ast.*;
import com.svparser.jackson.mixins.NodeMixin;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that configures serialization/deserialization for the AST records.
 *
 * This module handles:
 * - Polymorphic type handling via NodeMixin
 * - Serialization of loc property (instead of startLine/startCol/endLine/endCol)
 * - Deserialization with loc field transformation
 */
public class AstModule extends SimpleModule {

    // Fields to exclude from serialization (we use loc instead)
    private static final Set<String> EXCLUDED_FIELDS = Set.of("startLine", "startCol", "endLine", "endCol");

    // Node records; each gets NodeMixin explicitly since mixin inheritance from
    // sealed interfaces is not something to rely on for records
    private static final List<Class<? extends Node>> NODE_TYPES = List.of(
        Source.class,
        ClassDeclaration.class,
        ModuleDeclaration.class,
        FunctionDeclaration.class,
        SignalDeclaration.class,
        AlwaysBlock.class,
        IfStatement.class,
        CaseStatement.class,
        NestedBlock.class,
        GenericStatement.class
    );

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.svparser", "svtree-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(SourceItem.class, NodeMixin.class);
        context.setMixInAnnotations(BlockItem.class, NodeMixin.class);
        for (Class<? extends Node> type : NODE_TYPES) {
            context.setMixInAnnotations(type, NodeMixin.class);
        }

        // Drop startLine/startCol/endLine/endCol; loc carries them
        context.addBeanSerializerModifier(new AstSerializerModifier());

        // Fold loc back into startLine/startCol/endLine/endCol when reading
        context.addBeanDeserializerModifier(new AstDeserializerModifier());
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                          BeanDescription beanDesc,
                                                          List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }

            List<BeanPropertyWriter> filtered = new ArrayList<>();
            for (BeanPropertyWriter prop : beanProperties) {
                if (!EXCLUDED_FIELDS.contains(prop.getName())) {
                    filtered.add(prop);
                }
            }
            return filtered;
        }
    }

    // ==================== Deserializer Modifier ====================

    private static class AstDeserializerModifier extends BeanDeserializerModifier {
        @Override
        public JsonDeserializer<?> modifyDeserializer(DeserializationConfig config,
                                                       BeanDescription beanDesc,
                                                       JsonDeserializer<?> deserializer) {
            Class<?> beanClass = beanDesc.getBeanClass();
            if (Node.class.isAssignableFrom(beanClass) && beanClass.isRecord()) {
                return new AstNodeDeserializer(deserializer);
            }
            return deserializer;
        }
    }

    private static class AstNodeDeserializer extends JsonDeserializer<Object> implements ResolvableDeserializer {
        // Depth of nested calls per thread; only the outermost node transforms the tree
        private static final ThreadLocal<Integer> DEPTH = ThreadLocal.withInitial(() -> 0);

        private final JsonDeserializer<?> delegate;

        AstNodeDeserializer(JsonDeserializer<?> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void resolve(DeserializationContext ctxt) throws JsonMappingException {
            if (delegate instanceof ResolvableDeserializer) {
                ((ResolvableDeserializer) delegate).resolve(ctxt);
            }
        }

        @Override
        public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            int depth = DEPTH.get();

            // Nested node: the outermost call already transformed the whole tree
            if (depth > 0) {
                JsonNode node = p.readValueAsTree();
                JsonParser jp = node.traverse(p.getCodec());
                jp.nextToken();
                return delegate.deserialize(jp, ctxt);
            }

            JsonNode node = p.readValueAsTree();
            transformNode(node, true);

            DEPTH.set(depth + 1);
            try {
                JsonParser jp = node.traverse(p.getCodec());
                jp.nextToken();
                return delegate.deserialize(jp, ctxt);
            } finally {
                DEPTH.set(depth);
            }
        }

        /**
         * Replace {@code loc} with the four flat position fields, recursively.
         *
         * @param node      the JSON object
         * @param isAstNode true for the root and for objects carrying a "type" field
         */
        private void transformNode(JsonNode node, boolean isAstNode) {
            if (node == null || !node.isObject()) {
                return;
            }

            ObjectNode objNode = (ObjectNode) node;

            // Blocks and locations are plain objects; only walk into them
            if (!isAstNode && !objNode.has("type")) {
                objNode.fields().forEachRemaining(entry -> transformChild(entry.getValue()));
                return;
            }

            JsonNode loc = objNode.get("loc");
            if (loc != null && loc.isObject()) {
                objNode.put("startLine", loc.path("start").path("line").asInt(0));
                objNode.put("startCol", loc.path("start").path("column").asInt(0));
                objNode.put("endLine", loc.path("end").path("line").asInt(0));
                objNode.put("endCol", loc.path("end").path("column").asInt(0));
                objNode.remove("loc");
            } else {
                if (!objNode.has("startLine")) objNode.put("startLine", 0);
                if (!objNode.has("startCol")) objNode.put("startCol", 0);
                if (!objNode.has("endLine")) objNode.put("endLine", 0);
                if (!objNode.has("endCol")) objNode.put("endCol", 0);
            }

            if (!objNode.has("start")) objNode.put("start", 0);
            if (!objNode.has("end")) objNode.put("end", 0);

            objNode.fields().forEachRemaining(entry -> transformChild(entry.getValue()));
        }

        private void transformChild(JsonNode value) {
            if (value.isObject()) {
                transformNode(value, value.has("type"));
            } else if (value.isArray()) {
                value.forEach(child -> transformNode(child, child.has("type")));
            }
        }
    }
}
