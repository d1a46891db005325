package me.christianrobert.hlsl2glsl.converter.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.hlsl2glsl.config.service.ConfigService;
import me.christianrobert.hlsl2glsl.converter.ast.Program;
import me.christianrobert.hlsl2glsl.converter.context.ConversionException;
import me.christianrobert.hlsl2glsl.converter.context.ConversionResult;
import me.christianrobert.hlsl2glsl.converter.context.ShaderTarget;
import me.christianrobert.hlsl2glsl.converter.glsl.GlslConverter;
import me.christianrobert.hlsl2glsl.converter.util.AstTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service running the GLSL legalization on resolved HLSL syntax trees.
 *
 * <p>Architecture:
 * <pre>
 * HLSL Program (resolved) → GlslConverter (in place) → GLSL-ready Program → (code generator)
 *                                   ↓
 *                          ConversionContext per run
 * </pre>
 *
 * <p>Settings omitted by the caller (shader target, name mangling prefix, tree dump) are taken
 * from {@link ConfigService}. Failures never escape as exceptions; they are reported through
 * {@link ConversionResult#failure(String)}, and the partially converted tree is not handed out.
 */
@ApplicationScoped
public class ShaderConversionService {

    private static final Logger log = LoggerFactory.getLogger(ShaderConversionService.class);

    @Inject
    ConfigService configService;

    GlslConverter converter = new GlslConverter();

    /**
     * Converts the program with the configured shader target and name mangling prefix.
     *
     * @param program Resolved program to legalize in place
     * @return ConversionResult containing either the program or error details
     */
    public ConversionResult convert(Program program) {
        ShaderTarget shaderTarget;
        try {
            shaderTarget = configService.getConfigValueAsEnum(ConfigService.SHADER_TARGET, ShaderTarget.class);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid shader target configuration: {}", e.getMessage());
            return ConversionResult.failure(e.getMessage());
        }
        String prefix = configService.getConfigValueAsString(ConfigService.NAME_MANGLING_PREFIX);
        return convert(program, shaderTarget, prefix);
    }

    /**
     * Converts the program for the given target.
     *
     * @param program Resolved program to legalize in place
     * @param shaderTarget Target pipeline stage
     * @param nameManglingPrefix Prefix for renamed identifiers (null falls back to the configured one)
     * @return ConversionResult containing either the program or error details
     */
    public ConversionResult convert(Program program, ShaderTarget shaderTarget, String nameManglingPrefix) {
        Boolean includeAst = configService.getConfigValueAsBoolean(ConfigService.INCLUDE_AST);
        return convert(program, shaderTarget, nameManglingPrefix, Boolean.TRUE.equals(includeAst));
    }

    /**
     * Converts the program with optional tree dump of the result.
     *
     * <p>This is the master conversion method that all other overloads delegate to.</p>
     *
     * @param program Resolved program to legalize in place
     * @param shaderTarget Target pipeline stage
     * @param nameManglingPrefix Prefix for renamed identifiers (null falls back to the configured one)
     * @param includeAst Whether to include the formatted tree in the result (for debugging)
     * @return ConversionResult containing either the program or error details
     */
    public ConversionResult convert(Program program, ShaderTarget shaderTarget, String nameManglingPrefix, boolean includeAst) {
        if (program == null) {
            return ConversionResult.failure("Program cannot be null");
        }

        if (shaderTarget == null || shaderTarget == ShaderTarget.UNDEFINED) {
            return ConversionResult.failure("Shader target must be specified");
        }

        String prefix = nameManglingPrefix != null
                ? nameManglingPrefix
                : configService.getConfigValueAsString(ConfigService.NAME_MANGLING_PREFIX);
        if (prefix == null) {
            prefix = "";
        }

        log.debug("Converting program for target {} (prefix '{}')", shaderTarget, prefix);

        try {
            converter.convert(program, shaderTarget, prefix);

            log.info("Successfully converted program for target {}", shaderTarget);

            if (includeAst) {
                String astTree = AstTreeFormatter.format(program);
                log.trace("Converted tree:\n{}", astTree);
                return ConversionResult.successWithAst(program, astTree);
            }
            return ConversionResult.success(program);

        } catch (ConversionException e) {
            log.error("Conversion failed: {}", e.getDetailedMessage(), e);
            return ConversionResult.failure(e);

        } catch (Exception e) {
            log.error("Unexpected error during conversion", e);
            return ConversionResult.failure("Unexpected error: " + e.getMessage());
        }
    }
}
