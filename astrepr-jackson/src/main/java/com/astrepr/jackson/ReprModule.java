package com.astrepr.jackson;

import com.astrepr.tree.ReprNode;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Jackson module for {@link ReprNode} trees.
 *
 * A node is written as an object with the fields {@code kind}, {@code label}, {@code value},
 * {@code props}, {@code lists} and {@code children}. Only {@code kind} is always present;
 * the others are left out when empty.
 */
public class ReprModule extends SimpleModule {

    static final String KIND = "kind";
    static final String LABEL = "label";
    static final String VALUE = "value";
    static final String PROPS = "props";
    static final String LISTS = "lists";
    static final String CHILDREN = "children";

    public ReprModule() {
        super("ReprModule", new Version(1, 0, 0, null, "com.astrepr", "astrepr-jackson"));
        addSerializer(ReprNode.class, new ReprNodeSerializer());
    }

    private static class ReprNodeSerializer extends JsonSerializer<ReprNode> {
        @Override
        public void serialize(ReprNode node, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeStringField(KIND, node.kind());
            if (!node.label().isEmpty()) {
                gen.writeStringField(LABEL, node.label());
            }
            if (node.literalValue() != null) {
                gen.writeStringField(VALUE, node.literalValue());
            }

            if (!node.scalarProps().isEmpty()) {
                gen.writeObjectFieldStart(PROPS);
                for (Map.Entry<String, String> prop : node.scalarProps().entrySet()) {
                    gen.writeStringField(prop.getKey(), prop.getValue());
                }
                gen.writeEndObject();
            }

            if (!node.listProps().isEmpty()) {
                gen.writeObjectFieldStart(LISTS);
                for (Map.Entry<String, List<ReprNode>> list : node.listProps().entrySet()) {
                    gen.writeArrayFieldStart(list.getKey());
                    for (ReprNode element : list.getValue()) {
                        serialize(element, gen, serializers);
                    }
                    gen.writeEndArray();
                }
                gen.writeEndObject();
            }

            if (!node.children().isEmpty()) {
                gen.writeArrayFieldStart(CHILDREN);
                for (ReprNode child : node.children()) {
                    serialize(child, gen, serializers);
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }
    }
}
