package me.christianrobert.hlsl2glsl.converter.glsl;

import me.christianrobert.hlsl2glsl.converter.ast.Program;
import me.christianrobert.hlsl2glsl.converter.context.ConversionContext;
import me.christianrobert.hlsl2glsl.converter.context.ConversionException;
import me.christianrobert.hlsl2glsl.converter.context.ShaderTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Legalizes an HLSL syntax tree for GLSL code generation.
 *
 * <p>The tree must be fully parsed, symbol resolved and type annotated. It is mutated in place:
 * <ul>
 *   <li>Intrinsics: {@code saturate} becomes {@code clamp}, {@code sincos} statements are split</li>
 *   <li>Sampler state parameters and arguments of user functions are removed</li>
 *   <li>Half precision literal suffixes become float suffixes</li>
 *   <li>Member accesses through flattened structures or to system values are shortened</li>
 *   <li>Variables colliding with entry point semantics are renamed</li>
 *   <li>int/uint mismatches get explicit casts</li>
 *   <li>Nested unary expressions are bracketed, bare returns in the entry point get a block</li>
 * </ul>
 *
 * <p>The converter holds no per-run state and may be shared between threads, as long as each
 * tree is converted by only one of them.
 */
public class GlslConverter {

    private static final Logger log = LoggerFactory.getLogger(GlslConverter.class);

    private final StructResolutionPolicy structResolutionPolicy;

    /**
     * Creates a converter using {@link GlslHelper#DEFAULT_STRUCT_RESOLUTION}.
     */
    public GlslConverter() {
        this(GlslHelper.DEFAULT_STRUCT_RESOLUTION);
    }

    public GlslConverter(StructResolutionPolicy structResolutionPolicy) {
        if (structResolutionPolicy == null) {
            throw new IllegalArgumentException("Struct resolution policy cannot be null");
        }
        this.structResolutionPolicy = structResolutionPolicy;
    }

    /**
     * Converts the program in place.
     *
     * @param program Root of the tree to legalize
     * @param shaderTarget Target pipeline stage
     * @param nameManglingPrefix Prefix for renamed identifiers (may be empty)
     * @throws ConversionException on invalid intrinsic usage; the tree is then unusable
     */
    public void convert(Program program, ShaderTarget shaderTarget, String nameManglingPrefix) {
        if (program == null) {
            throw new IllegalArgumentException("Program cannot be null");
        }

        ConversionContext context = new ConversionContext(shaderTarget, nameManglingPrefix);
        log.debug("Converting program for target {} with name mangling prefix '{}'", shaderTarget, nameManglingPrefix);

        GlslConverterVisitor visitor = new GlslConverterVisitor(context, structResolutionPolicy);
        visitor.visit(program);

        log.debug("Conversion finished: {}", context);
    }

    public StructResolutionPolicy getStructResolutionPolicy() {
        return structResolutionPolicy;
    }
}
