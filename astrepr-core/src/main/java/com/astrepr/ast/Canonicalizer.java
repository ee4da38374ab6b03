package com.astrepr.ast;

import com.astrepr.tree.ReprNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a generic {@link ReprNode} tree into the canonical AST.
 *
 * This is the only place that decides which child of a node plays which role (the
 * condition of an if, the two sides of an assignment, the callee of a call, ...). Shapes
 * that cannot be mapped become {@link Other}; the pass itself never fails.
 */
public final class Canonicalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Canonicalizer.class);

    // Children that can stand on either side of an assignment
    private static final Set<String> ASSIGNABLE_KINDS = Set.of("RefExpr", "MemberAccess", "CallExpr", "LitConstExpr", "Block");
    private static final Set<String> TYPE_KINDS = Set.of("RefType", "PrimitiveType");
    private static final Set<String> MEMBER_BASE_KINDS = Set.of("RefExpr", "CallExpr", "MemberAccess");

    private Canonicalizer() {
        // Utility class
    }

    /**
     * @param file root produced by {@link com.astrepr.ReprParser}, must be of kind {@code File}
     */
    public static SourceFile canonicalize(ReprNode file) {
        if (!file.is("File")) {
            throw new IllegalArgumentException("Expected a File node, got " + file.kind());
        }
        List<Node> items = new ArrayList<>();
        for (ReprNode child : file.children()) {
            items.add(topLevel(child));
        }
        return new SourceFile(position(file), file.label().strip(), List.copyOf(items));
    }

    private static Node topLevel(ReprNode node) {
        return switch (node.kind()) {
            case "PackageSpec" -> new PackageSpec(position(node), orDefault(node.label(), "?"));
            case "ImportSpec" -> importSpec(node);
            case "ClassDecl" -> classDecl(node);
            case "MainDecl" -> mainDecl(node);
            default -> new Other(node);
        };
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private static ImportSpec importSpec(ReprNode node) {
        String prefixPaths = node.scalar("prefixPaths").orElse("").strip();
        return new ImportSpec(position(node), prefixPaths, orDefault(node.label(), ImportSpec.WILDCARD));
    }

    private static ClassDecl classDecl(ReprNode node) {
        List<TypeNode> inherited = new ArrayList<>();
        for (ReprNode type : node.list("inheritedTypes")) {
            inherited.add(typeNode(type));
        }

        List<Node> members = new ArrayList<>();
        for (ReprNode body : node.childrenOf("ClassBody")) {
            for (ReprNode member : body.children()) {
                members.add(switch (member.kind()) {
                    case "FuncDecl" -> funcDecl(member);
                    case "VarDecl" -> varDecl(member);
                    default -> new Other(member);
                });
            }
        }
        return new ClassDecl(position(node), node.label().strip(), List.copyOf(inherited), List.copyOf(members));
    }

    private static MainDecl mainDecl(ReprNode node) {
        for (ReprNode function : node.childrenOf("FuncDecl")) {
            if (function.label().strip().startsWith("main")) {
                Block body = function.firstChild("FuncBody")
                    .flatMap(funcBody -> funcBody.firstChild("Block"))
                    .map(Canonicalizer::block)
                    .orElse(Block.empty());
                return new MainDecl(position(node), body);
            }
        }
        return new MainDecl(position(node), Block.empty());
    }

    static FuncDecl funcDecl(ReprNode node) {
        String name = node.label().strip();
        // Some dumps label functions with their full signature: "foo (Int64) -> Unit"
        if (name.contains(" ") && name.contains("(")) {
            name = name.substring(0, name.indexOf('(')).strip();
        }

        List<FuncParam> parameters = new ArrayList<>();
        TypeNode returnType = null;
        Block body = null;
        Optional<ReprNode> funcBody = node.firstChild("FuncBody");
        if (funcBody.isPresent()) {
            for (ReprNode part : funcBody.get().children()) {
                if (part.is("FuncParamList")) {
                    for (ReprNode param : part.childrenOf("FuncParam")) {
                        parameters.add(funcParam(param));
                    }
                } else if (TYPE_KINDS.contains(part.kind()) && returnType == null) {
                    returnType = typeNode(part);
                } else if (part.is("Block") && body == null) {
                    body = block(part);
                }
            }
        }
        return new FuncDecl(position(node), name, List.copyOf(parameters), returnType, body);
    }

    private static FuncParam funcParam(ReprNode node) {
        return new FuncParam(position(node), orDefault(node.label(), "_"), firstType(node));
    }

    static VarDecl varDecl(ReprNode node) {
        String name = node.label().strip();
        if (name.startsWith("let ")) {
            name = name.substring(4).strip();
        }

        Node initializer = null;
        for (ReprNode child : node.children()) {
            if (!TYPE_KINDS.contains(child.kind())) {
                initializer = expression(child);
                break;
            }
        }
        return new VarDecl(position(node), name.isEmpty() ? "_" : name, firstType(node), initializer);
    }

    // ========================================================================
    // Statements and expressions
    // ========================================================================

    static Node statement(ReprNode node) {
        return switch (node.kind()) {
            case "VarDecl" -> varDecl(node);
            case "FuncDecl" -> funcDecl(node);
            default -> expression(node);
        };
    }

    static Expression expression(ReprNode node) {
        return switch (node.kind()) {
            case "Block" -> block(node);
            case "CallExpr" -> callExpr(node);
            case "MemberAccess" -> memberAccess(node);
            case "RefExpr" -> new RefExpr(position(node), orDefault(node.label(), "?"));
            case "LitConstExpr" -> literal(node);
            case "AssignExpr" -> assignExpr(node);
            case "BinaryExpr" -> binaryExpr(node);
            case "IfExpr" -> ifExpr(node);
            case "MatchExpr" -> matchExpr(node);
            case "LambdaExpr" -> lambdaExpr(node);
            case "TryExpr" -> tryExpr(node);
            case "ReturnExpr" -> new ReturnExpr(position(node), firstExpression(node, "ReturnExpr"));
            case "ThrowExpr" -> new ThrowExpr(position(node), firstExpression(node, null));
            default -> new Other(node);
        };
    }

    static Block block(ReprNode node) {
        List<Node> statements = new ArrayList<>();
        for (ReprNode child : node.children()) {
            statements.add(statement(child));
        }
        return new Block(position(node), List.copyOf(statements));
    }

    /**
     * A branch body that merely wraps another Block is rendered as the inner block.
     */
    private static Block braceBody(ReprNode node) {
        if (node.children().size() == 1 && node.children().get(0).is("Block")) {
            return block(node.children().get(0));
        }
        return block(node);
    }

    private static Expression callExpr(ReprNode node) {
        Expression callee = null;
        Optional<ReprNode> baseFunc = node.firstChild("BaseFunc");
        if (baseFunc.isPresent()) {
            callee = baseFunc(baseFunc.get());
        } else {
            Optional<ReprNode> member = node.firstChild("MemberAccess");
            if (member.isPresent()) {
                callee = memberAccess(member.get());
            }
        }
        if (callee == null) {
            return malformed(node, "no BaseFunc or MemberAccess callee");
        }

        List<Expression> arguments = new ArrayList<>();
        for (ReprNode argument : node.list("arguments")) {
            if (argument.is("FuncArg")) {
                for (ReprNode value : argument.children()) {
                    arguments.add(expression(value));
                }
            } else {
                arguments.add(expression(argument));
            }
        }
        return new CallExpr(position(node), callee, List.copyOf(arguments));
    }

    private static Expression baseFunc(ReprNode node) {
        for (ReprNode child : node.children()) {
            if (child.is("RefExpr")) {
                return new RefExpr(position(child), orDefault(child.label(), "?"));
            }
            if (child.is("MemberAccess")) {
                return memberAccess(child);
            }
        }
        return new RefExpr(position(node), "?");
    }

    private static MemberAccess memberAccess(ReprNode node) {
        String field = node.scalar("field").orElse(node.label()).strip();
        Expression base = null;
        for (ReprNode child : node.children()) {
            if (MEMBER_BASE_KINDS.contains(child.kind())) {
                base = expression(child);
                break;
            }
        }
        return new MemberAccess(position(node), base, field);
    }

    private static LitConstExpr literal(ReprNode node) {
        String subkind = node.label().strip();
        if (subkind.isEmpty()) {
            subkind = node.scalar("ty").orElse("").strip();
        }
        return new LitConstExpr(position(node), subkind, node.literalValue());
    }

    private static Expression assignExpr(ReprNode node) {
        List<ReprNode> sides = new ArrayList<>();
        for (ReprNode child : node.children()) {
            if (ASSIGNABLE_KINDS.contains(child.kind())) {
                sides.add(child);
            }
        }
        if (sides.size() == 2) {
            return new AssignExpr(position(node), expression(sides.get(0)), expression(sides.get(1)));
        }
        if (sides.size() == 1) {
            return new AssignExpr(position(node), null, expression(sides.get(0)));
        }
        return malformed(node, sides.size() + " assignable children");
    }

    private static Expression binaryExpr(ReprNode node) {
        if (node.children().size() != 2) {
            return malformed(node, node.children().size() + " operands");
        }
        String operator = node.label().strip();
        if (operator.isEmpty()) {
            operator = node.scalar("ty").orElse("?").strip();
        }
        return new BinaryExpr(position(node), operator,
            expression(node.children().get(0)), expression(node.children().get(1)));
    }

    private static Expression ifExpr(ReprNode node) {
        List<ReprNode> blocks = node.childrenOf("Block");
        if (blocks.size() > 2) {
            return malformed(node, blocks.size() + " Block children");
        }

        Expression condition = null;
        Expression elseBranch = null;
        boolean seenThen = false;
        for (ReprNode child : node.children()) {
            if (child.is("Block")) {
                seenThen = true;
            } else if (condition == null) {
                condition = expression(child);
            } else if (seenThen && child.is("IfExpr") && elseBranch == null) {
                elseBranch = expression(child);
            }
        }
        Block thenBranch = blocks.isEmpty() ? Block.empty() : braceBody(blocks.get(0));
        if (blocks.size() == 2) {
            elseBranch = braceBody(blocks.get(1));
        }
        return new IfExpr(position(node), condition, thenBranch, elseBranch);
    }

    private static Expression matchExpr(ReprNode node) {
        Expression selector = null;
        for (ReprNode child : node.children()) {
            if (child.is("selector")) {
                if (!child.children().isEmpty()) {
                    selector = expression(child.children().get(0));
                    break;
                }
                continue;
            }
            if (!child.is("MatchCase") && !child.is("patterns")) {
                selector = expression(child);
                break;
            }
        }

        List<MatchCase> cases = new ArrayList<>();
        for (ReprNode matchCase : node.list("matchCases")) {
            if (matchCase.is("MatchCase")) {
                cases.add(matchCase(matchCase));
            }
        }
        return new MatchExpr(position(node), selector, List.copyOf(cases));
    }

    private static MatchCase matchCase(ReprNode node) {
        List<Node> body = new ArrayList<>();
        List<ReprNode> exprOrDecls = node.list("exprOrDecls");
        if (!exprOrDecls.isEmpty()) {
            for (ReprNode item : exprOrDecls) {
                body.add(statement(item));
            }
        } else {
            node.firstChild("Block").ifPresent(block -> body.addAll(braceBody(block).statements()));
        }
        return new MatchCase(position(node), casePattern(node), List.copyOf(body));
    }

    private static CasePattern casePattern(ReprNode matchCase) {
        ReprNode patterns = null;
        for (ReprNode child : matchCase.children()) {
            if (child.is("patterns")) {
                patterns = child;
                break;
            }
            CasePattern direct = singlePattern(child);
            if (direct != null) {
                return direct;
            }
        }
        if (patterns == null) {
            return new UnknownPattern(position(matchCase));
        }

        Optional<String> wildcard = patterns.scalar("WildcardPattern");
        if (wildcard.isPresent()) {
            return new WildcardPattern(position(patterns), orDefault(wildcard.get(), "_"));
        }
        for (ReprNode child : patterns.children()) {
            CasePattern pattern = singlePattern(child);
            if (pattern != null) {
                return pattern;
            }
        }
        return new UnknownPattern(position(patterns));
    }

    private static CasePattern singlePattern(ReprNode node) {
        if (node.is("WildcardPattern")) {
            return new WildcardPattern(position(node), orDefault(node.label(), "_"));
        }
        if (node.is("TypePattern")) {
            String binding = node.firstChild("VarPattern")
                .map(variable -> orDefault(variable.label(), "_"))
                .orElse("_");
            String typeName = node.firstChild("RefType")
                .map(ReprNode::label)
                .map(String::strip)
                .filter(label -> !label.isEmpty())
                .orElseGet(() -> typeNameFromTy(node.scalar("ty").orElse("Unknown")));
            return new TypePattern(position(node), binding, typeName);
        }
        return null;
    }

    private static LambdaExpr lambdaExpr(ReprNode node) {
        Optional<ReprNode> funcBody = node.firstChild("FuncBody");
        if (funcBody.isEmpty()) {
            return new LambdaExpr(position(node), List.of(), null);
        }

        List<ReprNode> params = funcBody.get().list("FuncParamList");
        if (params.isEmpty()) {
            params = funcBody.get().firstChild("FuncParamList")
                .map(ReprNode::children)
                .orElse(List.of());
        }
        List<String> names = new ArrayList<>();
        for (ReprNode param : params) {
            if (param.is("FuncParam")) {
                names.add(orDefault(param.label(), "_"));
            }
        }
        Block body = funcBody.get().firstChild("Block")
            .map(Canonicalizer::braceBody)
            .orElse(Block.empty());
        return new LambdaExpr(position(node), List.copyOf(names), body);
    }

    private static TryExpr tryExpr(ReprNode node) {
        Block tryBlock = Block.empty();
        List<CatchClause> catches = new ArrayList<>();
        Block finallyBlock = null;
        for (ReprNode child : node.children()) {
            switch (child.kind()) {
                case "TryBlock" -> tryBlock = innerBlock(child).orElse(tryBlock);
                case "Catch" -> catches.add(catchClause(child));
                case "FinallyBlock" -> finallyBlock = innerBlock(child).orElse(Block.empty());
                default -> LOGGER.debug("Ignoring {} inside TryExpr", child.kind());
            }
        }
        return new TryExpr(position(node), tryBlock, List.copyOf(catches), finallyBlock);
    }

    private static CatchClause catchClause(ReprNode node) {
        String binding = null;
        String exceptionType = null;
        Optional<ReprNode> pattern = node.firstChild("CatchPattern")
            .flatMap(catchPattern -> catchPattern.firstChild("ExceptTypePattern"));
        if (pattern.isPresent()) {
            binding = pattern.get().firstChild("VarPattern")
                .map(variable -> orDefault(variable.label(), "_"))
                .orElse("_");
            exceptionType = pattern.get().firstChild("RefType")
                .map(type -> {
                    String label = type.label().strip();
                    return label.isEmpty() ? typeNameFromTy(type.scalar("ty").orElse("Unknown")) : label;
                })
                .orElse("Unknown");
        }
        Block body = node.firstChild("CatchBlock")
            .flatMap(Canonicalizer::innerBlock)
            .orElse(Block.empty());
        return new CatchClause(position(node), binding, exceptionType, body);
    }

    private static Optional<Block> innerBlock(ReprNode wrapper) {
        Block found = null;
        for (ReprNode child : wrapper.childrenOf("Block")) {
            found = block(child);
        }
        return Optional.ofNullable(found);
    }

    private static Expression firstExpression(ReprNode node, String skippedKind) {
        for (ReprNode child : node.children()) {
            if (skippedKind == null || !child.is(skippedKind)) {
                return expression(child);
            }
        }
        return null;
    }

    // ========================================================================
    // Types
    // ========================================================================

    private static TypeNode firstType(ReprNode node) {
        for (ReprNode child : node.children()) {
            if (TYPE_KINDS.contains(child.kind())) {
                return typeNode(child);
            }
        }
        return null;
    }

    static TypeNode typeNode(ReprNode node) {
        if (node.is("PrimitiveType")) {
            String name = node.label().strip();
            if (name.isEmpty()) {
                name = node.scalar("ty").orElse("Unknown").strip();
            }
            return new PrimitiveType(position(node), name);
        }

        String name = node.label().strip();
        if (name.isEmpty()) {
            name = typeNameFromTy(node.scalar("ty").orElse(""));
        }
        List<TypeNode> typeArguments = new ArrayList<>();
        for (ReprNode argument : node.list("typeArguments")) {
            typeArguments.add(typeNode(argument));
        }
        return new RefType(position(node), name, List.copyOf(typeArguments));
    }

    /**
     * {@code ty} values look like {@code Class-Foo<Int64>}; the simple name is the part after
     * the last dash, without type arguments.
     */
    static String typeNameFromTy(String ty) {
        String name = ty.strip();
        int dash = name.lastIndexOf('-');
        if (dash >= 0) {
            name = name.substring(dash + 1);
        }
        int angle = name.indexOf('<');
        if (angle >= 0) {
            name = name.substring(0, angle);
        }
        return name.strip();
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static Other malformed(ReprNode node, String reason) {
        LOGGER.debug("Keeping {} '{}' as a placeholder: {}", node.kind(), node.label(), reason);
        return new Other(node);
    }

    private static String position(ReprNode node) {
        return node.position().orElse(null);
    }

    private static String orDefault(String text, String fallback) {
        String stripped = text == null ? "" : text.strip();
        return stripped.isEmpty() ? fallback : stripped;
    }
}
