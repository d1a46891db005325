package me.christianrobert.hlsl2glsl.converter.context;

import me.christianrobert.hlsl2glsl.converter.ast.Program;

/**
 * Result of a conversion run.
 * Contains either the legalized program or an error message, plus an optional tree dump.
 */
public class ConversionResult {

    private final boolean success;
    private final Program program;
    private final String errorMessage;
    private final String astTree;

    private ConversionResult(boolean success, Program program, String errorMessage, String astTree) {
        this.success = success;
        this.program = program;
        this.errorMessage = errorMessage;
        this.astTree = astTree;
    }

    /**
     * Creates a successful result.
     */
    public static ConversionResult success(Program program) {
        return new ConversionResult(true, program, null, null);
    }

    /**
     * Creates a successful result including the dump of the legalized tree.
     */
    public static ConversionResult successWithAst(Program program, String astTree) {
        return new ConversionResult(true, program, null, astTree);
    }

    /**
     * Creates a failed result.
     */
    public static ConversionResult failure(String errorMessage) {
        return new ConversionResult(false, null, errorMessage, null);
    }

    /**
     * Creates a failed result from an exception.
     */
    public static ConversionResult failure(ConversionException exception) {
        return new ConversionResult(false, null, exception.getDetailedMessage(), null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Returns the legalized program, or null on failure (a partially converted tree is never handed out).
     */
    public Program getProgram() {
        return program;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "ConversionResult{success=true}";
        } else {
            return "ConversionResult{success=false, error='" + errorMessage + "'}";
        }
    }
}
