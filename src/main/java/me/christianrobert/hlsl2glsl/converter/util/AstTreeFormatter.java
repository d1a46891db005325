package me.christianrobert.hlsl2glsl.converter.util;

import me.christianrobert.hlsl2glsl.converter.ast.BinaryExpr;
import me.christianrobert.hlsl2glsl.converter.ast.CastExpr;
import me.christianrobert.hlsl2glsl.converter.ast.CtrlTransferStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.DefaultAstVisitor;
import me.christianrobert.hlsl2glsl.converter.ast.Expr;
import me.christianrobert.hlsl2glsl.converter.ast.FunctionCall;
import me.christianrobert.hlsl2glsl.converter.ast.FunctionDecl;
import me.christianrobert.hlsl2glsl.converter.ast.LiteralExpr;
import me.christianrobert.hlsl2glsl.converter.ast.Node;
import me.christianrobert.hlsl2glsl.converter.ast.StructDecl;
import me.christianrobert.hlsl2glsl.converter.ast.UnaryExpr;
import me.christianrobert.hlsl2glsl.converter.ast.VarAccessExpr;
import me.christianrobert.hlsl2glsl.converter.ast.VarDecl;
import me.christianrobert.hlsl2glsl.converter.ast.VarIdent;
import me.christianrobert.hlsl2glsl.converter.ast.VarType;
import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

/**
 * Formats syntax trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging and for checking what the legalization did to a tree.</p>
 *
 * <p>Example output:</p>
 * <pre>
 * Program
 *   FunctionDeclStmnt
 *     FunctionDecl "main" [entry point]
 *       VarType : float4
 *       CodeBlock
 *         ReturnStmnt
 *           FunctionCall clamp (CLAMP) : float4
 *             VarAccessExpr : float4
 *               VarIdent "color" -&gt; VarDecl
 * </pre>
 */
public class AstTreeFormatter {

    private static final String INDENT = "  ";
    private static final int MAX_TEXT_LENGTH = 50;

    /**
     * Formats a tree into human-readable text.
     *
     * @param root Root of the tree (any node)
     * @return Formatted string representation
     */
    public static String format(Node root) {
        if (root == null) {
            return "(null tree)";
        }
        FormattingVisitor visitor = new FormattingVisitor();
        visitor.visit(root);
        return visitor.sb.toString();
    }

    /**
     * Returns the one-line description of a node (without indentation or children).
     */
    static String describe(Node ast) {
        StringBuilder sb = new StringBuilder(ast.getClass().getSimpleName());

        if (ast instanceof VarIdent) {
            VarIdent varIdent = (VarIdent) ast;
            sb.append(" \"").append(escapeAndTruncate(varIdent.getIdent())).append("\"");
            if (varIdent.getSymbolRef() != null) {
                sb.append(" -> ").append(varIdent.getSymbolRef().getClass().getSimpleName());
            }
        } else if (ast instanceof VarDecl) {
            VarDecl varDecl = (VarDecl) ast;
            sb.append(" \"").append(varDecl.getIdent()).append("\"");
            appendFlag(sb, varDecl.isShaderInput(), "shader input");
            appendFlag(sb, varDecl.isShaderOutput(), "shader output");
            appendFlag(sb, varDecl.isSystemValue(), "system value");
        } else if (ast instanceof StructDecl) {
            StructDecl structDecl = (StructDecl) ast;
            sb.append(" \"").append(structDecl.getIdent()).append("\"");
        } else if (ast instanceof FunctionDecl) {
            FunctionDecl functionDecl = (FunctionDecl) ast;
            sb.append(" \"").append(functionDecl.getIdent()).append("\"");
            appendFlag(sb, functionDecl.isEntryPoint(), "entry point");
            appendFlag(sb, !functionDecl.isReachable(), "unreachable");
        } else if (ast instanceof VarType) {
            sb.append(" : ").append(((VarType) ast).getTypeDenoter().toTypeString());
        } else if (ast instanceof LiteralExpr) {
            sb.append(" \"").append(escapeAndTruncate(((LiteralExpr) ast).getValue())).append("\"");
        } else if (ast instanceof BinaryExpr) {
            sb.append(" ").append(((BinaryExpr) ast).getOp().getSpell());
        } else if (ast instanceof UnaryExpr) {
            sb.append(" ").append(((UnaryExpr) ast).getOp().getSpell());
        } else if (ast instanceof CastExpr) {
            sb.append(" to ").append(((CastExpr) ast).getCastType().toTypeString());
        } else if (ast instanceof FunctionCall) {
            FunctionCall call = (FunctionCall) ast;
            String name = call.getIntrinsic().isUndefined() || call.getIntrinsic().getGlslName() == null
                    ? call.getCalleeName()
                    : call.getIntrinsic().getGlslName();
            sb.append(" ").append(name).append(" (").append(call.getIntrinsic()).append(")");
        } else if (ast instanceof VarAccessExpr) {
            VarAccessExpr access = (VarAccessExpr) ast;
            if (access.isAssignment()) {
                sb.append(" ").append(access.getAssignOp().getSpell());
            }
        } else if (ast instanceof CtrlTransferStmnt) {
            sb.append(" ").append(((CtrlTransferStmnt) ast).getTransfer().getSpell());
        }

        if (ast instanceof Expr) {
            TypeDenoter typeDenoter = ((Expr) ast).findTypeDenoter();
            sb.append(" : ").append(typeDenoter != null ? typeDenoter.toTypeString() : "?");
        }

        return sb.toString();
    }

    private static void appendFlag(StringBuilder sb, boolean set, String flag) {
        if (set) {
            sb.append(" [").append(flag).append("]");
        }
    }

    /**
     * Escapes special characters and truncates long text.
     */
    private static String escapeAndTruncate(String text) {
        if (text == null) {
            return "";
        }

        String escaped = text
            .replace("\\", "\\\\")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t")
            .replace("\"", "\\\"");

        if (escaped.length() > MAX_TEXT_LENGTH) {
            return escaped.substring(0, MAX_TEXT_LENGTH - 3) + "...";
        }

        return escaped;
    }

    /**
     * Prints one line per node and lets the default traversal descend into the children.
     */
    private static class FormattingVisitor extends DefaultAstVisitor {

        private final StringBuilder sb = new StringBuilder();
        private int depth;

        @Override
        public void visit(Node ast) {
            if (ast == null) {
                return;
            }
            for (int i = 0; i < depth; i++) {
                sb.append(INDENT);
            }
            sb.append(describe(ast)).append("\n");

            depth++;
            ast.accept(this);
            depth--;
        }
    }
}
