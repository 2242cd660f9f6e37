package com.sodacuration.domain.execution.model;

/**
 * Optional sampling parameters. A {@code null} field is not sent to the provider.
 */
public record SamplingParams(
        Double temperature,
        Double topP,
        Double frequencyPenalty,
        Double presencePenalty,
        Integer maxTokens
) {

    /**
     * Checks every present value against the provider's accepted range.
     *
     * @throws IllegalArgumentException naming the first out-of-range parameter and its value
     */
    public void validate() {
        checkRange("Temperature", temperature, 0, 2);
        checkRange("Top_p", topP, 0, 1);
        checkRange("Frequency penalty", frequencyPenalty, -2, 2);
        checkRange("Presence penalty", presencePenalty, -2, 2);
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException(
                    String.format("Max tokens must be positive, value: `%d`", maxTokens));
        }
    }

    /**
     * As {@link #validate()}, with the Messages API temperature range of [0, 1] for Anthropic models.
     */
    public void validateFor(ModelProvider provider) {
        validate();
        if (provider == ModelProvider.ANTHROPIC) {
            checkRange("Temperature", temperature, 0, 1);
        }
    }

    public boolean isEmpty() {
        return temperature == null && topP == null && frequencyPenalty == null
                && presencePenalty == null && maxTokens == null;
    }

    private static void checkRange(String name, Double value, double min, double max) {
        if (value != null && (value.isNaN() || value < min || value > max)) {
            throw new IllegalArgumentException(String.format(
                    "%s must be between %s and %s, value: `%s`", name, trim(min), trim(max), value));
        }
    }

    private static String trim(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
