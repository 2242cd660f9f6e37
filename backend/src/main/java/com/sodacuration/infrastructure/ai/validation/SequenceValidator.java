package com.sodacuration.infrastructure.ai.validation;

import com.sodacuration.domain.verification.exception.InvalidSequenceInputException;
import com.sodacuration.domain.verification.model.LabelAlphabet;
import com.sodacuration.domain.verification.model.SequenceResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks that panel labels form a gap-free run and proposes the repaired run.
 *
 * The alphabet is decided by the first label, in this order: Roman numeral (I to X),
 * uppercase letter, lowercase letter, digits. Letter and number runs must match the
 * expected run element by element; Roman runs only need the same set of values.
 */
@Slf4j
@Component
public class SequenceValidator {

    static final String VALID = "Sequence is valid";
    static final String NO_LABELS = "No panel labels provided";
    static final String UNKNOWN_TYPE = "Unable to determine sequence type from labels";
    static final int MAX_NUMERIC_SPAN = 1000;

    private static final Pattern DECORATORS = Pattern.compile("[().\\s]");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,9}");

    private static final Set<String> ROMAN_PANEL_TOKENS = Set.of(
            "I", "II", "III", "IV", "V", "VI", "VII", "VIII", "IX", "X"
    );

    public SequenceResult verify(List<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return new SequenceResult(false, List.of(), NO_LABELS);
        }
        List<String> cleaned = labels.stream()
                .map(label -> label == null ? "" : DECORATORS.matcher(label).replaceAll(""))
                .toList();

        LabelAlphabet alphabet;
        try {
            alphabet = classify(cleaned.get(0));
        } catch (InvalidSequenceInputException e) {
            log.info("[SequenceValidator] Unrecognized first label '{}'", cleaned.get(0));
            return new SequenceResult(false, cleaned, e.getMessage());
        }
        log.debug("[SequenceValidator] {} labels classified as {}", cleaned.size(), alphabet);

        return switch (alphabet) {
            case ROMAN -> verifyRoman(cleaned);
            case UPPERCASE -> verifyLetters(cleaned, 'A');
            case LOWERCASE -> verifyLetters(cleaned, 'a');
            case NUMERIC -> verifyNumeric(cleaned);
        };
    }

    static LabelAlphabet classify(String label) {
        if (ROMAN_PANEL_TOKENS.contains(label)) {
            return LabelAlphabet.ROMAN;
        }
        if (label.length() == 1 && label.charAt(0) >= 'A' && label.charAt(0) <= 'Z') {
            return LabelAlphabet.UPPERCASE;
        }
        if (label.length() == 1 && label.charAt(0) >= 'a' && label.charAt(0) <= 'z') {
            return LabelAlphabet.LOWERCASE;
        }
        if (DIGITS.matcher(label).matches()) {
            return LabelAlphabet.NUMERIC;
        }
        throw new InvalidSequenceInputException(UNKNOWN_TYPE);
    }

    private SequenceResult verifyLetters(List<String> labels, char first) {
        List<String> foreign = new ArrayList<>();
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (String label : labels) {
            if (label.length() == 1 && label.charAt(0) >= first && label.charAt(0) < first + 26) {
                int position = label.charAt(0) - first;
                min = Math.min(min, position);
                max = Math.max(max, position);
            } else {
                foreign.add(label);
            }
        }

        List<String> expected = new ArrayList<>();
        for (int position = min; position <= max; position++) {
            expected.add(String.valueOf((char) (first + position)));
        }
        if (!foreign.isEmpty()) {
            return new SequenceResult(false, expected,
                    "Labels contain characters not in the expected alphabet: " + String.join(", ", foreign));
        }
        return compareInOrder(labels, expected);
    }

    // Compares parsed values, so zero-padded labels such as "01", "02" form a valid run
    private SequenceResult verifyNumeric(List<String> labels) {
        List<String> invalid = new ArrayList<>();
        List<Integer> values = new ArrayList<>();
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (String label : labels) {
            if (DIGITS.matcher(label).matches()) {
                int value = Integer.parseInt(label);
                values.add(value);
                min = Math.min(min, value);
                max = Math.max(max, value);
            } else {
                invalid.add(label);
            }
        }

        if (max - min + 1 > MAX_NUMERIC_SPAN) {
            log.warn("[SequenceValidator] Numeric labels span {} to {}, not expanding", min, max);
            return new SequenceResult(false, labels, String.format(
                    "Numeric labels span %d to %d, wider than %d panels", min, max, MAX_NUMERIC_SPAN));
        }

        List<String> expected = new ArrayList<>();
        List<Integer> expectedValues = new ArrayList<>();
        for (int value = min; value <= max; value++) {
            expected.add(String.valueOf(value));
            expectedValues.add(value);
        }
        if (!invalid.isEmpty()) {
            return new SequenceResult(false, expected,
                    "Invalid numeric value in sequence: " + String.join(", ", invalid));
        }
        boolean valid = values.equals(expectedValues);
        return new SequenceResult(valid, expected, valid ? VALID : gapsDetail(expected));
    }

    // Set comparison, not order: ["II", "I", "III"] passes here while ["B", "A", "C"] fails above
    private SequenceResult verifyRoman(List<String> labels) {
        List<String> invalid = new ArrayList<>();
        Set<Integer> observed = new HashSet<>();
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (String label : labels) {
            if (RomanNumerals.isCanonical(label)) {
                int value = RomanNumerals.toInt(label);
                observed.add(value);
                min = Math.min(min, value);
                max = Math.max(max, value);
            } else {
                invalid.add(label);
            }
        }

        List<String> expected = new ArrayList<>();
        Set<Integer> expectedValues = new HashSet<>();
        for (int value = min; value <= max; value++) {
            expected.add(RomanNumerals.toRoman(value));
            expectedValues.add(value);
        }
        if (!invalid.isEmpty()) {
            return new SequenceResult(false, expected,
                    "Invalid Roman numeral in sequence: " + String.join(", ", invalid));
        }

        boolean valid = observed.equals(expectedValues);
        return new SequenceResult(valid, expected, valid ? VALID : gapsDetail(expected));
    }

    private SequenceResult compareInOrder(List<String> labels, List<String> expected) {
        boolean valid = labels.equals(expected);
        return new SequenceResult(valid, expected, valid ? VALID : gapsDetail(expected));
    }

    private static String gapsDetail(List<String> expected) {
        return "Sequence has gaps or is out of order. Fixed sequence: " + String.join(", ", expected);
    }
}
