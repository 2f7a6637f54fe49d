package com.saika.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.saika.ast.*;
import com.saika.jackson.mixins.NodeMixin;

import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the syntax tree records.
 *
 * This module handles:
 * - Polymorphic type handling via NodeMixin
 * - Keeping derived accessors such as ForStatement.isClassic() out of the JSON
 */
public class AstModule extends SimpleModule {

    // Interfaces and records that carry the "type" discriminator
    private static final List<Class<?>> NODE_TYPES = List.of(
        Node.class, Statement.class, Expression.class, TypeExpression.class,
        Program.class,
        PackageStatement.class, ImportStatement.class, ImportGroup.class, FunctionStatement.class,
        VariableStatement.class, ReturnStatement.class, IfStatement.class, RangeStatement.class,
        BlockStatement.class, BreakStatement.class, ContinueStatement.class, ExpressionStatement.class,
        Identifier.class, IntegerLiteral.class, FloatLiteral.class, BooleanLiteral.class,
        StringLiteral.class, CharLiteral.class, ArrayLiteral.class, HashLiteral.class,
        UnaryExpression.class, BinaryExpression.class, AssignmentExpression.class, MemberExpression.class,
        IndexExpression.class, CallExpression.class,
        NamedType.class, ArrayType.class, MapType.class, StructType.class
    );

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, "SNAPSHOT", "com.saika", "saika-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling on every node type explicitly
        // (mixin inheritance from interfaces is not applied consistently to records)
        for (Class<?> type : NODE_TYPES) {
            context.setMixInAnnotations(type, NodeMixin.class);
        }

        // ForStatement needs more than the discriminator
        context.setMixInAnnotations(ForStatement.class, ForStatementMixin.class);
    }

    // ==================== Serialization Mixins ====================

    // isClassic() is derived from init/post and must not become a "classic" property
    private abstract static class ForStatementMixin extends NodeMixin {
        @JsonIgnore
        abstract boolean isClassic();
    }
}
