package com.jsdesugar.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.jsdesugar.ast.ClassDeclaration;
import com.jsdesugar.ast.ClassExpression;
import com.jsdesugar.ast.Expression;
import com.jsdesugar.ast.ForStatement;
import com.jsdesugar.ast.FunctionDeclaration;
import com.jsdesugar.ast.FunctionExpression;
import com.jsdesugar.ast.Identifier;
import com.jsdesugar.ast.IfStatement;
import com.jsdesugar.ast.Literal;
import com.jsdesugar.ast.MethodDefinition;
import com.jsdesugar.ast.Node;
import com.jsdesugar.ast.PropertyDefinition;
import com.jsdesugar.ast.ReturnStatement;
import com.jsdesugar.ast.Span;
import com.jsdesugar.ast.Statement;
import com.jsdesugar.ast.TemplateElement;
import com.jsdesugar.ast.VariableDeclarator;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Jackson module that maps the AST records onto ESTree JSON.
 *
 * This module handles:
 * - The "type" property, taken from {@link Node#type()}
 * - Flattening the span into start, end and loc
 * - Null fields that ESTree always writes (id, alternate, superClass, ...)
 * - JavaScript-compatible number serialization for literals
 */
public class AstModule extends SimpleModule {

    // Node classes whose null fields must still be written, or whose names differ from ESTree
    private static final Map<Class<?>, Class<?>> SPECIAL_MIXINS = Map.ofEntries(
        Map.entry(Literal.class, LiteralMixin.class),
        Map.entry(MethodDefinition.class, MethodDefinitionMixin.class),
        Map.entry(PropertyDefinition.class, PropertyDefinitionMixin.class),
        Map.entry(VariableDeclarator.class, VariableDeclaratorMixin.class),
        Map.entry(FunctionExpression.class, FunctionIdMixin.class),
        Map.entry(FunctionDeclaration.class, FunctionIdMixin.class),
        Map.entry(IfStatement.class, IfStatementMixin.class),
        Map.entry(ForStatement.class, ForStatementMixin.class),
        Map.entry(ReturnStatement.class, ReturnStatementMixin.class),
        Map.entry(ClassDeclaration.class, ClassMixin.class),
        Map.entry(ClassExpression.class, ClassMixin.class)
    );

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.jsdesugar", "desugar-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Mixins are registered on each record: annotations on the sealed interfaces
        // do not reach record component accessors reliably
        for (Class<?> nodeClass : concreteNodeClasses()) {
            context.setMixInAnnotations(nodeClass, SPECIAL_MIXINS.getOrDefault(nodeClass, NodeMixin.class));
        }
        context.setMixInAnnotations(TemplateElement.TemplateElementValue.class, TemplateElementValueMixin.class);
    }

    /**
     * Every record reachable from {@link Node} through the sealed hierarchy.
     */
    static Set<Class<?>> concreteNodeClasses() {
        Set<Class<?>> found = new LinkedHashSet<>();
        collect(Node.class, found);
        return found;
    }

    private static void collect(Class<?> type, Set<Class<?>> found) {
        if (type.isRecord()) {
            found.add(type);
            return;
        }
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted == null) {
            return;
        }
        for (Class<?> subclass : permitted) {
            collect(subclass, found);
        }
    }

    // ==================== Serialization Mixins ====================

    @JsonPropertyOrder({"type", "span"})
    private abstract static class NodeMixin {
        @JsonProperty("type")
        abstract String type();

        @JsonUnwrapped
        abstract Span span();
    }

    private abstract static class LiteralMixin extends NodeMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    private abstract static class MethodDefinitionMixin extends NodeMixin {
        @JsonProperty("static")
        abstract boolean isStatic();
    }

    private abstract static class PropertyDefinitionMixin extends NodeMixin {
        @JsonProperty("static")
        abstract boolean isStatic();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression value();
    }

    private abstract static class VariableDeclaratorMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression init();
    }

    private abstract static class FunctionIdMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();
    }

    private abstract static class IfStatementMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Statement alternate();
    }

    private abstract static class ForStatementMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Node init();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression test();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression update();
    }

    private abstract static class ReturnStatementMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression argument();
    }

    private abstract static class ClassMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression superClass();
    }

    // cooked is null for template strings with invalid escapes
    private abstract static class TemplateElementValueMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract String cooked();
    }
}
