package com.astrepr.codegen;

import com.astrepr.ast.*;
import com.astrepr.tree.ReprNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a canonical AST as approximate source text.
 *
 * Every node renders to something: kinds without a canonical form, and known kinds with an
 * unexpected shape, come out as a {@code /* kind: label prop=value *}{@code /} placeholder.
 *
 * Rendering works bottom-up on self-contained text: a node's rendering starts at column 0
 * and its nested lines are indented relative to that. Whoever places the text on a line
 * shifts the whole block with {@link Indentation#reindent(String, String)}.
 */
public class CodeGenerator {

    static final String INDENT = "    ";

    // How many scalar properties a placeholder shows
    private static final int PLACEHOLDER_PROPS = 3;

    private final GeneratorOptions options;

    public CodeGenerator() {
        this(GeneratorOptions.DEFAULTS);
    }

    public CodeGenerator(GeneratorOptions options) {
        this.options = options;
    }

    /**
     * Canonicalizes and renders a parsed {@code File} root.
     */
    public String generate(ReprNode file) {
        return generate(Canonicalizer.canonicalize(file));
    }

    public String generate(SourceFile file) {
        StringBuilder out = new StringBuilder();
        out.append(positionLine(file, ""));

        Node previous = null;
        for (Node item : file.items()) {
            if (previous != null) {
                // Consecutive imports stay together, everything else gets a blank line
                boolean importRun = previous instanceof ImportSpec && item instanceof ImportSpec;
                out.append(importRun ? "\n" : "\n\n");
            }
            out.append(line(item, ""));
            previous = item;
        }
        return out.append('\n').toString();
    }

    public static String generate(ReprNode file, GeneratorOptions options) {
        return new CodeGenerator(options).generate(file);
    }

    /**
     * Renders {@code node} on its own line(s) starting at {@code indent}, preceded by its
     * position comment when enabled.
     */
    String line(Node node, String indent) {
        return positionLine(node, indent) + Indentation.reindent(render(node), indent);
    }

    private String positionLine(Node node, String indent) {
        if (!options.includePositionComments()) {
            return "";
        }
        String position = node.position();
        if (position == null || position.isBlank()) {
            return "";
        }
        return indent + "// position: " + position + "\n";
    }

    /**
     * Renders a node starting at column 0, without position comment.
     */
    String render(Node node) {
        if (node instanceof Expression expression) {
            return expression(expression);
        }
        if (node instanceof PackageSpec packageSpec) {
            return "package " + packageSpec.name();
        }
        if (node instanceof ImportSpec importSpec) {
            return importSpec(importSpec);
        }
        if (node instanceof ClassDecl classDecl) {
            return classDecl(classDecl);
        }
        if (node instanceof MainDecl mainDecl) {
            return "main() " + block(mainDecl.body());
        }
        if (node instanceof FuncDecl funcDecl) {
            return funcDecl(funcDecl);
        }
        if (node instanceof VarDecl varDecl) {
            return varDecl(varDecl);
        }
        if (node instanceof FuncParam param) {
            return param(param);
        }
        if (node instanceof MatchCase matchCase) {
            return matchCase(matchCase);
        }
        if (node instanceof CatchClause catchClause) {
            return catchClause(catchClause).strip();
        }
        if (node instanceof TypeNode type) {
            return type(type);
        }
        if (node instanceof CasePattern pattern) {
            return pattern(pattern);
        }
        if (node instanceof SourceFile file) {
            return generate(file).stripTrailing();
        }
        throw new IllegalStateException("Unhandled node " + node.kind());
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private String importSpec(ImportSpec importSpec) {
        String prefix = importSpec.prefixPaths().isEmpty() ? "" : importSpec.prefixPaths() + ".";
        if (importSpec.isWildcard()) {
            return "import " + prefix + ImportSpec.WILDCARD;
        }
        return "import " + prefix + "{" + importSpec.item() + "}";
    }

    private String classDecl(ClassDecl classDecl) {
        StringBuilder out = new StringBuilder("class ").append(identifier(classDecl.name()));
        if (!classDecl.inheritedTypes().isEmpty()) {
            List<String> bases = new ArrayList<>();
            for (TypeNode base : classDecl.inheritedTypes()) {
                bases.add(type(base));
            }
            out.append(" <: ").append(String.join(", ", bases));
        }
        out.append(" {\n");
        List<String> members = new ArrayList<>();
        for (Node member : classDecl.members()) {
            members.add(line(member, INDENT));
        }
        if (!members.isEmpty()) {
            out.append(String.join("\n\n", members)).append('\n');
        }
        return out.append('}').toString();
    }

    private String funcDecl(FuncDecl funcDecl) {
        List<String> params = new ArrayList<>();
        for (FuncParam param : funcDecl.parameters()) {
            params.add(param(param));
        }
        String body = block(funcDecl.body() != null ? funcDecl.body() : Block.empty());
        if (funcDecl.isInit()) {
            return "init(" + String.join(", ", params) + ") " + body;
        }
        String returnType = funcDecl.returnType() != null ? type(funcDecl.returnType()) : "Unit";
        return "func " + identifier(funcDecl.name()) + "(" + String.join(", ", params) + "): " + returnType + " " + body;
    }

    private String param(FuncParam param) {
        String type = param.type() != null ? type(param.type()) : "Unknown";
        return identifier(param.name()) + ": " + type;
    }

    private String varDecl(VarDecl varDecl) {
        StringBuilder out = new StringBuilder("let ").append(identifier(varDecl.name()));
        if (varDecl.type() != null) {
            out.append(": ").append(type(varDecl.type()));
        }
        if (varDecl.initializer() != null) {
            out.append(" = ").append(render(varDecl.initializer()));
        }
        return out.toString();
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private String expression(Expression expression) {
        if (expression instanceof Block block) {
            return block(block);
        }
        if (expression instanceof CallExpr call) {
            return call(call);
        }
        if (expression instanceof MemberAccess member) {
            return memberAccess(member);
        }
        if (expression instanceof RefExpr ref) {
            return identifier(ref.name());
        }
        if (expression instanceof LitConstExpr literal) {
            return literal(literal);
        }
        if (expression instanceof AssignExpr assign) {
            String right = optional(assign.right(), "()");
            return assign.left() == null ? "= " + right : expression(assign.left()) + " = " + right;
        }
        if (expression instanceof BinaryExpr binary) {
            return "(" + expression(binary.left()) + " " + binary.operator() + " " + expression(binary.right()) + ")";
        }
        if (expression instanceof IfExpr ifExpr) {
            return ifExpr(ifExpr);
        }
        if (expression instanceof MatchExpr match) {
            return match(match);
        }
        if (expression instanceof LambdaExpr lambda) {
            return lambda(lambda);
        }
        if (expression instanceof TryExpr tryExpr) {
            return tryExpr(tryExpr);
        }
        if (expression instanceof ReturnExpr returnExpr) {
            return "return " + optional(returnExpr.value(), "()");
        }
        if (expression instanceof ThrowExpr throwExpr) {
            return throwExpr.value() == null ? "throw" : "throw " + expression(throwExpr.value());
        }
        if (expression instanceof Other other) {
            return placeholder(other.source());
        }
        throw new IllegalStateException("Unhandled expression " + expression.kind());
    }

    String block(Block block) {
        if (block.statements().isEmpty()) {
            return "{\n}";
        }
        return "{\n" + statements(block.statements()) + "\n}";
    }

    private String statements(List<Node> statements) {
        List<String> lines = new ArrayList<>();
        for (Node statement : statements) {
            lines.add(line(statement, INDENT));
        }
        return String.join("\n", lines);
    }

    private String call(CallExpr call) {
        String callee = expression(call.callee());
        // Constructor calls are dumped as calls to "<Type>.init"
        if (callee.endsWith(".init")) {
            callee = callee.substring(0, callee.length() - ".init".length());
        }
        List<String> arguments = new ArrayList<>();
        for (Expression argument : call.arguments()) {
            arguments.add(expression(argument));
        }
        return callee + "(" + String.join(", ", arguments) + ")";
    }

    private String memberAccess(MemberAccess member) {
        String field = identifier(member.field());
        if (member.base() == null) {
            return field;
        }
        return expression(member.base()) + "." + field;
    }

    private String literal(LitConstExpr literal) {
        String value = literal.value();
        boolean empty = value == null || value.isEmpty();
        switch (literal.literalKind()) {
            case STRING:
                return "\"" + (empty ? "" : value) + "\"";
            case INTEGER:
                return empty ? "0" : value;
            case BOOL:
                return "true".equalsIgnoreCase(value) ? "true" : "false";
            default:
                return empty ? "()" : value;
        }
    }

    private String ifExpr(IfExpr ifExpr) {
        String condition = optional(ifExpr.condition(), "true");
        StringBuilder out = new StringBuilder("if (").append(condition).append(") ").append(block(ifExpr.thenBranch()));
        if (ifExpr.elseBranch() != null) {
            out.append(" else ").append(expression(ifExpr.elseBranch()));
        }
        return out.toString();
    }

    private String match(MatchExpr match) {
        StringBuilder out = new StringBuilder("match (").append(optional(match.selector(), "")).append(") {\n");
        List<String> cases = new ArrayList<>();
        for (MatchCase matchCase : match.cases()) {
            cases.add(line(matchCase, INDENT));
        }
        if (!cases.isEmpty()) {
            out.append(String.join("\n", cases)).append('\n');
        }
        return out.append('}').toString();
    }

    private String matchCase(MatchCase matchCase) {
        String head = "case " + pattern(matchCase.pattern()) + " =>";
        if (matchCase.body().isEmpty()) {
            return head;
        }
        return head + "\n" + statements(matchCase.body());
    }

    private String pattern(CasePattern pattern) {
        if (pattern instanceof WildcardPattern wildcard) {
            return identifier(wildcard.name());
        }
        if (pattern instanceof TypePattern typed) {
            return identifier(typed.binding()) + ": " + identifier(typed.typeName());
        }
        return "?";
    }

    private String lambda(LambdaExpr lambda) {
        if (lambda.body() == null && lambda.parameters().isEmpty()) {
            return "{ }";
        }
        List<String> params = new ArrayList<>();
        for (String param : lambda.parameters()) {
            params.add(identifier(param));
        }
        String head = params.isEmpty() ? "{ =>" : "{ " + String.join(", ", params) + " =>";
        Block body = lambda.body() != null ? lambda.body() : Block.empty();
        if (body.statements().isEmpty()) {
            return head + "\n}";
        }
        return head + "\n" + statements(body.statements()) + "\n}";
    }

    private String tryExpr(TryExpr tryExpr) {
        StringBuilder out = new StringBuilder("try ").append(block(tryExpr.tryBlock()));
        for (CatchClause catchClause : tryExpr.catches()) {
            out.append(catchClause(catchClause));
        }
        if (tryExpr.finallyBlock() != null) {
            out.append(" finally ").append(block(tryExpr.finallyBlock()));
        }
        return out.toString();
    }

    private String catchClause(CatchClause catchClause) {
        if (!catchClause.hasPattern()) {
            return " catch " + block(catchClause.body());
        }
        return " catch (" + identifier(catchClause.binding()) + ": " + identifier(catchClause.exceptionType()) + ") "
            + block(catchClause.body());
    }

    // ========================================================================
    // Types, identifiers, placeholders
    // ========================================================================

    String type(TypeNode type) {
        if (type instanceof PrimitiveType primitive) {
            return identifier(primitive.name());
        }
        RefType ref = (RefType) type;
        String name = ref.name().isEmpty() ? "Unit" : identifier(ref.name());
        if (ref.typeArguments().isEmpty()) {
            return name;
        }
        List<String> arguments = new ArrayList<>();
        for (TypeNode argument : ref.typeArguments()) {
            arguments.add(type(argument));
        }
        return name + "<" + String.join(", ", arguments) + ">";
    }

    String identifier(String name) {
        return options.sanitizeIdentifiers() ? Identifiers.sanitize(name) : name;
    }

    private String optional(Expression expression, String fallback) {
        return expression == null ? fallback : expression(expression);
    }

    /**
     * {@code /* Kind: label key=value ... *}{@code /}, showing the first few scalar properties.
     */
    static String placeholder(ReprNode node) {
        StringBuilder info = new StringBuilder(node.kind()).append(':');
        if (!node.label().isBlank()) {
            info.append(' ').append(node.label().strip());
        }
        int shown = 0;
        for (Map.Entry<String, String> prop : node.scalarProps().entrySet()) {
            if (shown++ == PLACEHOLDER_PROPS) {
                break;
            }
            info.append(' ').append(prop.getKey()).append('=').append(prop.getValue());
        }
        // A "*/" inside a value would end the comment early
        return "/* " + info.toString().replace("*/", "* /") + " */";
    }
}
