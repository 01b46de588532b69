package com.raditha.quotient.normalization;

import com.github.javaparser.ast.ArrayCreationLevel;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.ast.type.*;
import com.raditha.quotient.model.IdentifierRole;
import com.raditha.quotient.model.NodeKind;
import com.raditha.quotient.model.NormalizedToken;
import com.raditha.quotient.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns JavaParser subtrees into canonical token streams.
 * <p>
 * Key design principle: identifiers are grouped by the syntactic role they play,
 * never by their literal name, so that two fragments differing only in variable,
 * method or type names produce identical streams. Literal values are reduced to
 * their kind. Operators, primitive types and modifiers are structure and are kept.
 */
public class TokenNormalizer {

    /**
     * Normalize a subtree into tokens, in pre-order.
     *
     * @param root Root of the subtree
     * @param file Repository path used for the token spans
     * @return Canonical tokens
     */
    public List<NormalizedToken> tokenize(Node root, String file) {
        List<NormalizedToken> tokens = new ArrayList<>();
        if (root == null) {
            return tokens;
        }

        root.walk(Node.TreeTraversal.PREORDER, node -> {
            NormalizedToken token = normalizeNode(node, file);
            if (token != null) {
                tokens.add(token);
            }
        });

        return tokens;
    }

    /**
     * Normalize a list of subtrees, concatenating their streams.
     */
    public List<NormalizedToken> tokenizeAll(List<? extends Node> roots, String file) {
        List<NormalizedToken> allTokens = new ArrayList<>();
        for (Node root : roots) {
            allTokens.addAll(tokenize(root, file));
        }
        return allTokens;
    }

    /**
     * Normalize a single AST node into a token.
     * Returns null for nodes we want to skip (names, comments, import machinery).
     */
    private NormalizedToken normalizeNode(Node node, String file) {
        if (node instanceof SimpleName || node instanceof Name
                || node instanceof com.github.javaparser.ast.comments.Comment
                || node instanceof UnknownType || node instanceof ArrayCreationLevel
                || node instanceof ReceiverParameter) {
            return null;
        }

        // Declarations
        if (node instanceof ClassOrInterfaceDeclaration decl) {
            return createToken(NodeKind.CLASS_DECL, IdentifierRole.TYPE,
                    decl.isInterface() ? "interface" : "class", decl.getNameAsString(), node, file);
        }
        if (node instanceof EnumDeclaration decl) {
            return createToken(NodeKind.ENUM_DECL, IdentifierRole.TYPE, "", decl.getNameAsString(), node, file);
        }
        if (node instanceof RecordDeclaration decl) {
            return createToken(NodeKind.RECORD_DECL, IdentifierRole.TYPE, "", decl.getNameAsString(), node, file);
        }
        if (node instanceof AnnotationDeclaration decl) {
            return createToken(NodeKind.ANNOTATION_DECL, IdentifierRole.TYPE, "", decl.getNameAsString(), node, file);
        }
        if (node instanceof AnnotationMemberDeclaration decl) {
            return createToken(NodeKind.METHOD_DECL, IdentifierRole.FUNC, "annotation", decl.getNameAsString(), node, file);
        }
        if (node instanceof EnumConstantDeclaration decl) {
            return createToken(NodeKind.ENUM_CONSTANT, IdentifierRole.FIELD, "", decl.getNameAsString(), node, file);
        }
        if (node instanceof FieldDeclaration) {
            return createToken(NodeKind.FIELD_DECL, IdentifierRole.NONE, "", "", node, file);
        }
        if (node instanceof MethodDeclaration decl) {
            return createToken(NodeKind.METHOD_DECL, IdentifierRole.FUNC, "", decl.getNameAsString(), node, file);
        }
        if (node instanceof ConstructorDeclaration decl) {
            return createToken(NodeKind.CONSTRUCTOR_DECL, IdentifierRole.TYPE, "", decl.getNameAsString(), node, file);
        }
        if (node instanceof CompactConstructorDeclaration decl) {
            return createToken(NodeKind.CONSTRUCTOR_DECL, IdentifierRole.TYPE, "compact", decl.getNameAsString(), node, file);
        }
        if (node instanceof InitializerDeclaration decl) {
            return createToken(NodeKind.INITIALIZER, IdentifierRole.NONE, decl.isStatic() ? "static" : "", "", node, file);
        }
        if (node instanceof Parameter param) {
            return createToken(NodeKind.PARAMETER, IdentifierRole.PARAM,
                    param.isVarArgs() ? "..." : "", param.getNameAsString(), node, file);
        }
        if (node instanceof VariableDeclarator declarator) {
            IdentifierRole role = declarator.getParentNode().filter(FieldDeclaration.class::isInstance).isPresent()
                    ? IdentifierRole.FIELD
                    : IdentifierRole.VAR;
            return createToken(NodeKind.VARIABLE, role, "", declarator.getNameAsString(), node, file);
        }

        // Statements
        if (node instanceof BlockStmt) {
            return createToken(NodeKind.BLOCK, IdentifierRole.NONE, "", "", node, file);
        }
        if (node instanceof ExpressionStmt) {
            return createToken(NodeKind.EXPRESSION_STMT, IdentifierRole.NONE, "", "", node, file);
        }
        if (node instanceof IfStmt) {
            return createToken(NodeKind.IF, IdentifierRole.NONE, "", "if", node, file);
        }
        if (node instanceof ForStmt) {
            return createToken(NodeKind.FOR, IdentifierRole.NONE, "", "for", node, file);
        }
        if (node instanceof ForEachStmt) {
            return createToken(NodeKind.FOREACH, IdentifierRole.NONE, "", "for", node, file);
        }
        if (node instanceof WhileStmt) {
            return createToken(NodeKind.WHILE, IdentifierRole.NONE, "", "while", node, file);
        }
        if (node instanceof DoStmt) {
            return createToken(NodeKind.DO, IdentifierRole.NONE, "", "do", node, file);
        }
        if (node instanceof SwitchStmt) {
            return createToken(NodeKind.SWITCH, IdentifierRole.NONE, "stmt", "switch", node, file);
        }
        if (node instanceof SwitchExpr) {
            return createToken(NodeKind.SWITCH, IdentifierRole.NONE, "expr", "switch", node, file);
        }
        if (node instanceof SwitchEntry entry) {
            String detail = entry.getLabels().isEmpty() ? "default" : entry.getType().name();
            return createToken(NodeKind.SWITCH_ENTRY, IdentifierRole.NONE, detail, "case", node, file);
        }
        if (node instanceof TryStmt) {
            return createToken(NodeKind.TRY, IdentifierRole.NONE, "", "try", node, file);
        }
        if (node instanceof CatchClause) {
            return createToken(NodeKind.CATCH, IdentifierRole.NONE, "", "catch", node, file);
        }
        if (node instanceof ReturnStmt) {
            return createToken(NodeKind.RETURN, IdentifierRole.NONE, "", "return", node, file);
        }
        if (node instanceof ThrowStmt) {
            return createToken(NodeKind.THROW, IdentifierRole.NONE, "", "throw", node, file);
        }
        if (node instanceof BreakStmt stmt) {
            return stmt.getLabel().isPresent()
                    ? createToken(NodeKind.BREAK, IdentifierRole.LABEL, "", stmt.getLabel().get().asString(), node, file)
                    : createToken(NodeKind.BREAK, IdentifierRole.NONE, "", "break", node, file);
        }
        if (node instanceof ContinueStmt stmt) {
            return stmt.getLabel().isPresent()
                    ? createToken(NodeKind.CONTINUE, IdentifierRole.LABEL, "", stmt.getLabel().get().asString(), node, file)
                    : createToken(NodeKind.CONTINUE, IdentifierRole.NONE, "", "continue", node, file);
        }
        if (node instanceof YieldStmt) {
            return createToken(NodeKind.YIELD, IdentifierRole.NONE, "", "yield", node, file);
        }
        if (node instanceof SynchronizedStmt) {
            return createToken(NodeKind.SYNCHRONIZED, IdentifierRole.NONE, "", "synchronized", node, file);
        }
        if (node instanceof LabeledStmt stmt) {
            return createToken(NodeKind.LABELED, IdentifierRole.LABEL, "", stmt.getLabel().asString(), node, file);
        }
        if (node instanceof AssertStmt) {
            return createToken(NodeKind.ASSERT, IdentifierRole.NONE, "", "assert", node, file);
        }
        if (node instanceof LocalClassDeclarationStmt || node instanceof LocalRecordDeclarationStmt) {
            return createToken(NodeKind.LOCAL_TYPE, IdentifierRole.NONE, "", "", node, file);
        }
        if (node instanceof ExplicitConstructorInvocationStmt stmt) {
            return createToken(NodeKind.EXPLICIT_CONSTRUCTOR_CALL, IdentifierRole.NONE,
                    stmt.isThis() ? "this" : "super", "", node, file);
        }
        if (node instanceof EmptyStmt) {
            return createToken(NodeKind.EMPTY, IdentifierRole.NONE, "", ";", node, file);
        }

        // Literals (text blocks first, they are not plain string literals)
        if (node instanceof TextBlockLiteralExpr) {
            return createToken(NodeKind.TEXT_BLOCK_LIT, IdentifierRole.NONE, "", node.toString(), node, file);
        }
        if (node instanceof StringLiteralExpr) {
            return createToken(NodeKind.STRING_LIT, IdentifierRole.NONE, "", node.toString(), node, file);
        }
        if (node instanceof CharLiteralExpr) {
            return createToken(NodeKind.CHAR_LIT, IdentifierRole.NONE, "", node.toString(), node, file);
        }
        if (node instanceof IntegerLiteralExpr) {
            return createToken(NodeKind.INT_LIT, IdentifierRole.NONE, "", node.toString(), node, file);
        }
        if (node instanceof LongLiteralExpr) {
            return createToken(NodeKind.LONG_LIT, IdentifierRole.NONE, "", node.toString(), node, file);
        }
        if (node instanceof DoubleLiteralExpr) {
            return createToken(NodeKind.DOUBLE_LIT, IdentifierRole.NONE, "", node.toString(), node, file);
        }
        if (node instanceof BooleanLiteralExpr) {
            return createToken(NodeKind.BOOLEAN_LIT, IdentifierRole.NONE, "", node.toString(), node, file);
        }
        if (node instanceof NullLiteralExpr) {
            return createToken(NodeKind.NULL_LIT, IdentifierRole.NONE, "", "null", node, file);
        }

        // Expressions
        if (node instanceof NameExpr nameExpr) {
            String name = nameExpr.getNameAsString();
            IdentifierRole role = isParameterOfEnclosingScope(nameExpr, name)
                    ? IdentifierRole.PARAM
                    : IdentifierRole.VAR;
            return createToken(NodeKind.NAME, role, "", name, node, file);
        }
        if (node instanceof FieldAccessExpr fieldAccess) {
            return createToken(NodeKind.FIELD_ACCESS, IdentifierRole.FIELD, "", fieldAccess.getNameAsString(), node, file);
        }
        if (node instanceof MethodCallExpr methodCall) {
            return createToken(NodeKind.METHOD_CALL, IdentifierRole.FUNC, "", methodCall.getNameAsString(), node, file);
        }
        if (node instanceof MethodReferenceExpr reference) {
            return createToken(NodeKind.METHOD_REFERENCE, IdentifierRole.FUNC, "", reference.getIdentifier(), node, file);
        }
        if (node instanceof ObjectCreationExpr creation) {
            return createToken(NodeKind.OBJECT_CREATION, IdentifierRole.NONE,
                    creation.getAnonymousClassBody().isPresent() ? "anonymous" : "", "new", node, file);
        }
        if (node instanceof AssignExpr assign) {
            String operator = assign.getOperator().asString();
            return createToken(NodeKind.ASSIGN, IdentifierRole.NONE, operator, operator, node, file);
        }
        if (node instanceof BinaryExpr binaryExpr) {
            String operator = binaryExpr.getOperator().asString();
            return createToken(NodeKind.BINARY, IdentifierRole.NONE, operator, operator, node, file);
        }
        if (node instanceof UnaryExpr unaryExpr) {
            String operator = unaryExpr.getOperator().asString();
            String detail = unaryExpr.isPostfix() ? "post" + operator : operator;
            return createToken(NodeKind.UNARY, IdentifierRole.NONE, detail, operator, node, file);
        }
        if (node instanceof ConditionalExpr) {
            return createToken(NodeKind.CONDITIONAL, IdentifierRole.NONE, "", "?:", node, file);
        }
        if (node instanceof LambdaExpr) {
            return createToken(NodeKind.LAMBDA, IdentifierRole.NONE, "", "->", node, file);
        }
        if (node instanceof CastExpr) {
            return createToken(NodeKind.CAST, IdentifierRole.NONE, "", "", node, file);
        }
        if (node instanceof InstanceOfExpr) {
            return createToken(NodeKind.INSTANCE_OF, IdentifierRole.NONE, "", "instanceof", node, file);
        }
        if (node instanceof PatternExpr) {
            return createToken(NodeKind.VARIABLE, IdentifierRole.VAR, "pattern", "", node, file);
        }
        if (node instanceof ArrayAccessExpr) {
            return createToken(NodeKind.ARRAY_ACCESS, IdentifierRole.NONE, "", "[]", node, file);
        }
        if (node instanceof ArrayCreationExpr) {
            return createToken(NodeKind.ARRAY_CREATION, IdentifierRole.NONE, "", "new[]", node, file);
        }
        if (node instanceof ArrayInitializerExpr) {
            return createToken(NodeKind.ARRAY_INITIALIZER, IdentifierRole.NONE, "", "{}", node, file);
        }
        if (node instanceof ThisExpr) {
            return createToken(NodeKind.THIS, IdentifierRole.NONE, "", "this", node, file);
        }
        if (node instanceof SuperExpr) {
            return createToken(NodeKind.SUPER, IdentifierRole.NONE, "", "super", node, file);
        }
        if (node instanceof ClassExpr) {
            return createToken(NodeKind.CLASS_LITERAL, IdentifierRole.NONE, "", ".class", node, file);
        }
        if (node instanceof EnclosedExpr) {
            return createToken(NodeKind.ENCLOSED, IdentifierRole.NONE, "", "()", node, file);
        }
        if (node instanceof VariableDeclarationExpr) {
            return createToken(NodeKind.VARIABLE_DECL_EXPR, IdentifierRole.NONE, "", "", node, file);
        }
        if (node instanceof AnnotationExpr annotation) {
            return createToken(NodeKind.ANNOTATION, IdentifierRole.TYPE, "", annotation.getNameAsString(), node, file);
        }

        // Types
        if (node instanceof PrimitiveType primitive) {
            String keyword = primitive.asString();
            return createToken(NodeKind.TYPE, IdentifierRole.NONE, keyword, keyword, node, file);
        }
        if (node instanceof VoidType) {
            return createToken(NodeKind.TYPE, IdentifierRole.NONE, "void", "void", node, file);
        }
        if (node instanceof VarType) {
            return createToken(NodeKind.TYPE, IdentifierRole.NONE, "var", "var", node, file);
        }
        if (node instanceof ArrayType) {
            return createToken(NodeKind.TYPE, IdentifierRole.NONE, "[]", "[]", node, file);
        }
        if (node instanceof WildcardType) {
            return createToken(NodeKind.TYPE, IdentifierRole.NONE, "?", "?", node, file);
        }
        if (node instanceof UnionType) {
            return createToken(NodeKind.TYPE, IdentifierRole.NONE, "|", "|", node, file);
        }
        if (node instanceof IntersectionType) {
            return createToken(NodeKind.TYPE, IdentifierRole.NONE, "&", "&", node, file);
        }
        if (node instanceof ClassOrInterfaceType type) {
            return createToken(NodeKind.TYPE, IdentifierRole.TYPE, "", type.getNameAsString(), node, file);
        }
        if (node instanceof TypeParameter parameter) {
            return createToken(NodeKind.TYPE, IdentifierRole.TYPE, "param", parameter.getNameAsString(), node, file);
        }

        if (node instanceof Modifier modifier) {
            String keyword = modifier.getKeyword().asString();
            return createToken(NodeKind.MODIFIER, IdentifierRole.NONE, keyword, keyword, node, file);
        }

        if (node instanceof MemberValuePair) {
            return createToken(NodeKind.OTHER, IdentifierRole.NONE, "member", "", node, file);
        }

        // Other nodes (package and import declarations, module directives) carry no code structure
        return null;
    }

    /**
     * True when the name is a parameter of an enclosing method, constructor, lambda or catch clause.
     */
    private boolean isParameterOfEnclosingScope(NameExpr nameExpr, String name) {
        Node current = nameExpr.getParentNode().orElse(null);
        while (current != null) {
            if (current instanceof CallableDeclaration<?> callable && declares(callable.getParameters(), name)) {
                return true;
            }
            if (current instanceof LambdaExpr lambda && declares(lambda.getParameters(), name)) {
                return true;
            }
            if (current instanceof CatchClause clause && clause.getParameter().getNameAsString().equals(name)) {
                return true;
            }
            if (current instanceof TypeDeclaration<?>) {
                return false;
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    private boolean declares(NodeList<Parameter> parameters, String name) {
        for (Parameter parameter : parameters) {
            if (parameter.getNameAsString().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Create a token from a node.
     */
    private NormalizedToken createToken(NodeKind kind, IdentifierRole role, String detail, String text,
                                        Node node, String file) {
        SourceSpan span = node.getRange()
                .map(r -> SourceSpan.from(file, r))
                .orElse(new SourceSpan(file, 0, 0));
        return new NormalizedToken(kind, role, detail, text, span);
    }
}
