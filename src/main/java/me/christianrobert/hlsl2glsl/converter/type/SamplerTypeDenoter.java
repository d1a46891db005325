package me.christianrobert.hlsl2glsl.converter.type;

/**
 * Sampler state object type ({@code SamplerState}, {@code SamplerComparisonState}).
 *
 * <p>GLSL has no first-class sampler state value; such state is bound out-of-band.</p>
 */
public class SamplerTypeDenoter extends TypeDenoter {

    private final boolean comparison;

    public SamplerTypeDenoter() {
        this(false);
    }

    public SamplerTypeDenoter(boolean comparison) {
        this.comparison = comparison;
    }

    public boolean isComparison() {
        return comparison;
    }

    @Override
    public boolean isSampler() {
        return true;
    }

    @Override
    public String toTypeString() {
        return comparison ? "SamplerComparisonState" : "SamplerState";
    }
}
