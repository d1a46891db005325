package me.christianrobert.hlsl2glsl.converter.context;

import me.christianrobert.hlsl2glsl.converter.ast.SourceArea;

/**
 * Fatal error during legalization. Aborts the whole conversion; the tree is left partially
 * converted and must not be passed to code generation.
 */
public class ConversionException extends RuntimeException {

    private final SourceArea area;
    private final String context;

    public ConversionException(String message) {
        this(message, null, null);
    }

    public ConversionException(String message, SourceArea area) {
        this(message, area, null);
    }

    public ConversionException(String message, SourceArea area, String context) {
        super(message);
        this.area = area;
        this.context = context;
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
        this.area = null;
        this.context = null;
    }

    /**
     * Returns the source location of the offending node, or null if unknown.
     */
    public SourceArea getArea() {
        return area;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including source location and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (area != null && area.isValid()) {
            sb.append(" (at ").append(area).append(")");
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
