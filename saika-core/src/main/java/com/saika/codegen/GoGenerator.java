package com.saika.codegen;

import com.saika.Diagnostic;
import com.saika.Dialect;
import com.saika.ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link Program} as Go source text.
 *
 * <p>One instance renders one program: indentation and the error list are instance state.
 * A statement that cannot appear where it was found is reported as an error and rendered as
 * empty text; the rest of the tree is still generated.</p>
 */
public class GoGenerator implements StatementVisitor<String>, ExpressionVisitor<String> {

    /** Element type of array literals and value type of map literals; contents are not inspected. */
    public static final String PLACEHOLDER_TYPE = "interface{}";

    private static final String INDENT = "\t";

    private final Dialect dialect;
    private final List<Diagnostic> errors = new ArrayList<>();
    private int indent = 0;

    public GoGenerator() {
        this(Dialect.defaults());
    }

    public GoGenerator(Dialect dialect) {
        this.dialect = dialect;
    }

    public String generate(Program program) {
        StringBuilder out = new StringBuilder();
        for (Statement statement : program.statements()) {
            out.append(statement.accept(this)).append('\n');
        }
        return out.toString();
    }

    public List<Diagnostic> errors() {
        return Collections.unmodifiableList(errors);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    @Override
    public String visitPackage(PackageStatement node) {
        if (nested(node)) {
            return "";
        }
        return "package " + node.name();
    }

    @Override
    public String visitImport(ImportStatement node) {
        if (nested(node)) {
            return "";
        }
        return "import " + importSpec(node);
    }

    @Override
    public String visitImportGroup(ImportGroup node) {
        if (nested(node)) {
            return "";
        }
        StringBuilder out = new StringBuilder("import (\n");
        for (ImportStatement spec : node.imports()) {
            out.append(INDENT).append(importSpec(spec)).append('\n');
        }
        return out.append(')').toString();
    }

    private static String importSpec(ImportStatement node) {
        String path = node.path().startsWith("\"") ? node.path() : "\"" + node.path() + "\"";
        return node.alias() != null ? node.alias() + " " + path : path;
    }

    @Override
    public String visitFunction(FunctionStatement node) {
        if (nested(node)) {
            return "";
        }
        String parameters = node.parameters().stream()
            .map(p -> p.declaredType() != null ? p.name().name() + " " + type(p.declaredType()) : p.name().name())
            .collect(Collectors.joining(", "));

        StringBuilder out = new StringBuilder("func ")
            .append(dialect.translateFunctionName(node.name().name()))
            .append('(').append(parameters).append(") ");
        if (node.returnType() != null) {
            out.append(type(node.returnType())).append(' ');
        }
        return out.append(visitBlock(node.body())).toString();
    }

    @Override
    public String visitVariable(VariableStatement node) {
        StringBuilder out = new StringBuilder(node.constant() ? "const " : "var ").append(node.name().name());
        if (node.declaredType() != null) {
            out.append(' ').append(type(node.declaredType()));
        }
        if (node.value() != null) {
            out.append(" = ").append(expression(node.value()));
        }
        return out.toString();
    }

    @Override
    public String visitReturn(ReturnStatement node) {
        return node.value() != null ? "return " + expression(node.value()) : "return";
    }

    @Override
    public String visitIf(IfStatement node) {
        String out = "if " + expression(node.condition()) + " " + visitBlock(node.consequence());
        if (node.alternative() != null) {
            out += " else " + visitBlock(node.alternative());
        }
        return out;
    }

    @Override
    public String visitFor(ForStatement node) {
        StringBuilder out = new StringBuilder("for ");
        if (node.isClassic()) {
            out.append(forClause(node.init())).append("; ");
            out.append(node.condition() != null ? expression(node.condition()) : "").append("; ");
            out.append(forClause(node.post())).append(' ');
        } else if (node.condition() != null) {
            out.append(expression(node.condition())).append(' ');
        }
        return out.append(visitBlock(node.body())).toString();
    }

    // init and post clauses only take simple statements; declarations use := form
    private String forClause(Statement clause) {
        if (clause == null) {
            return "";
        }
        if (clause instanceof ExpressionStatement statement) {
            return expression(statement.expression());
        }
        if (clause instanceof VariableStatement variable) {
            if (variable.value() == null) {
                error("variable declaration in a for clause requires an initializer", variable.position());
                return "";
            }
            String value = expression(variable.value());
            if (variable.declaredType() != null) {
                value = type(variable.declaredType()) + "(" + value + ")";
            }
            return variable.name().name() + " := " + value;
        }
        unsupported(clause);
        return "";
    }

    @Override
    public String visitRange(RangeStatement node) {
        StringBuilder out = new StringBuilder("for ");
        if (node.key() != null && node.value() != null) {
            out.append(node.key().name()).append(", ").append(node.value().name()).append(" := ");
        } else if (node.key() != null) {
            out.append(node.key().name()).append(" := ");
        } else if (node.value() != null) {
            out.append(node.value().name()).append(" := ");
        }
        return out.append("range ").append(expression(node.collection())).append(' ')
            .append(visitBlock(node.body())).toString();
    }

    @Override
    public String visitBlock(BlockStatement node) {
        StringBuilder out = new StringBuilder("{\n");
        indent++;
        for (Statement statement : node.statements()) {
            out.append(indentation()).append(statement.accept(this)).append('\n');
        }
        indent--;
        return out.append(indentation()).append('}').toString();
    }

    @Override
    public String visitBreak(BreakStatement node) {
        return "break";
    }

    @Override
    public String visitContinue(ContinueStatement node) {
        return "continue";
    }

    @Override
    public String visitStruct(StructType node) {
        String body = structBody(node);
        return node.name() != null ? "type " + node.name().name() + " " + body : body;
    }

    @Override
    public String visitExpressionStatement(ExpressionStatement node) {
        return expression(node.expression());
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name();
    }

    @Override
    public String visitInteger(IntegerLiteral node) {
        return Long.toString(node.value());
    }

    @Override
    public String visitFloat(FloatLiteral node) {
        return node.literal();
    }

    @Override
    public String visitBoolean(BooleanLiteral node) {
        return node.value() ? "true" : "false";
    }

    @Override
    public String visitString(StringLiteral node) {
        return "\"" + node.value() + "\"";
    }

    @Override
    public String visitChar(CharLiteral node) {
        return "'" + node.value() + "'";
    }

    @Override
    public String visitArray(ArrayLiteral node) {
        return node.elements().stream()
            .map(this::expression)
            .collect(Collectors.joining(", ", "[]" + PLACEHOLDER_TYPE + "{", "}"));
    }

    @Override
    public String visitHash(HashLiteral node) {
        return node.pairs().stream()
            .map(pair -> expression(pair.key()) + ": " + expression(pair.value()))
            .collect(Collectors.joining(", ", "map[string]" + PLACEHOLDER_TYPE + "{", "}"));
    }

    @Override
    public String visitUnary(UnaryExpression node) {
        String operand = expression(node.operand());
        if (node.postfix()) {
            return operand + node.operator();
        }
        // -(-x) must not collapse into the -- token
        if (node.operand() instanceof UnaryExpression inner && !inner.postfix()) {
            operand = "(" + operand + ")";
        }
        return node.operator() + operand;
    }

    @Override
    public String visitBinary(BinaryExpression node) {
        return "(" + expression(node.left()) + " " + node.operator() + " " + expression(node.right()) + ")";
    }

    @Override
    public String visitAssignment(AssignmentExpression node) {
        return expression(node.left()) + " " + node.operator() + " " + expression(node.right());
    }

    @Override
    public String visitMember(MemberExpression node) {
        return expression(node.object()) + "." + node.property().name();
    }

    @Override
    public String visitIndex(IndexExpression node) {
        return expression(node.base()) + "[" + expression(node.index()) + "]";
    }

    @Override
    public String visitCall(CallExpression node) {
        return expression(node.callee()) + node.arguments().stream()
            .map(this::expression)
            .collect(Collectors.joining(", ", "(", ")"));
    }

    // ========================================================================
    // Types
    // ========================================================================

    @Override
    public String visitNamedType(NamedType node) {
        return dialect.translateType(node.name());
    }

    @Override
    public String visitArrayType(ArrayType node) {
        return "[]" + type(node.elementType());
    }

    @Override
    public String visitMapType(MapType node) {
        return "map[" + type(node.keyType()) + "]" + type(node.valueType());
    }

    @Override
    public String visitStructType(StructType node) {
        return structBody(node);
    }

    private String structBody(StructType node) {
        StringBuilder out = new StringBuilder("struct {\n");
        indent++;
        for (StructField field : node.fields()) {
            out.append(indentation()).append(field.name()).append(' ').append(type(field.declaredType())).append('\n');
        }
        indent--;
        return out.append(indentation()).append('}').toString();
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private String expression(Expression node) {
        return node.accept(this);
    }

    private String type(TypeExpression node) {
        return expression(node);
    }

    private String indentation() {
        return INDENT.repeat(indent);
    }

    // top-level-only statements found inside a block
    private boolean nested(Statement node) {
        if (indent > 0) {
            unsupported(node);
            return true;
        }
        return false;
    }

    private void unsupported(Node node) {
        error("unsupported node type: " + node.type(), node.position());
    }

    private void error(String message, Position position) {
        errors.add(Diagnostic.error(message, position));
    }
}
