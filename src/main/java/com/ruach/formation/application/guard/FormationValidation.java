package com.ruach.formation.application.guard;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pure validators run ahead of event creation.
 * <p>
 * <b>Never throws:</b> every rule violation is reported through the
 * returned {@link ValidationResult}.
 * </p>
 */
public final class FormationValidation {

    public static final int DEFAULT_MIN_WORDS = 50;

    /** Letters and digits required per expected word */
    private static final int CHARACTERS_PER_WORD = 3;

    private static final Pattern CHECKPOINT_ID = Pattern.compile("^checkpoint-[a-z]+-\\d+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FormationValidation() {
    }

    public static ValidationResult validateReflection(String content) {
        return validateReflection(content, DEFAULT_MIN_WORDS);
    }

    /**
     * Checks that a reflection is present, long enough, and made of words
     * rather than filler.
     *
     * @param content  reflection text
     * @param minWords minimum number of whitespace-separated words
     */
    public static ValidationResult validateReflection(String content, int minWords) {
        if (content == null || content.isBlank()) {
            return ValidationResult.failure(new ValidationError("content", ValidationError.REQUIRED,
                    "Reflection content is required"));
        }

        List<ValidationError> errors = new ArrayList<>();
        int words = countWords(content);
        if (words < minWords) {
            errors.add(new ValidationError("content", ValidationError.MIN_WORDS,
                    String.format("Reflection must be at least %d words (currently %d)", minWords, words),
                    Map.of("wordCount", words, "minWords", minWords)));
        }

        long substantive = content.chars().filter(Character::isLetterOrDigit).count();
        long requiredCharacters = (long) minWords * CHARACTERS_PER_WORD;
        if (substantive < requiredCharacters) {
            errors.add(new ValidationError("content", ValidationError.INSUFFICIENT_CONTENT,
                    "Reflection does not contain enough substantive content",
                    Map.of("characters", substantive, "requiredCharacters", requiredCharacters)));
        }
        return ValidationResult.of(errors);
    }

    /**
     * @param actualSeconds  time spent since the checkpoint was reached
     * @param minimumSeconds required pause
     */
    public static ValidationResult validateDwellTime(long actualSeconds, long minimumSeconds) {
        if (actualSeconds >= minimumSeconds) {
            return ValidationResult.ok();
        }
        long remaining = minimumSeconds - actualSeconds;
        return ValidationResult.failure(new ValidationError("dwellTime", ValidationError.INSUFFICIENT_DWELL,
                String.format("Please spend at least %d more seconds with this content", remaining),
                Map.of("actualSeconds", actualSeconds, "minimumSeconds", minimumSeconds,
                        "remainingSeconds", remaining)));
    }

    /**
     * Accepts ids of the form {@code checkpoint-<phase-slug>-<n>}.
     */
    public static ValidationResult validateCheckpointId(String checkpointId) {
        if (checkpointId == null || checkpointId.isBlank()) {
            return ValidationResult.failure(new ValidationError("checkpointId", ValidationError.REQUIRED,
                    "Checkpoint id is required"));
        }
        if (!CHECKPOINT_ID.matcher(checkpointId).matches()) {
            return ValidationResult.failure(new ValidationError("checkpointId", ValidationError.INVALID_FORMAT,
                    "Invalid checkpoint id format: " + checkpointId,
                    Map.of("value", checkpointId)));
        }
        return ValidationResult.ok();
    }

    /**
     * @return number of whitespace-separated words, 0 for blank text
     */
    public static int countWords(String content) {
        if (content == null) {
            return 0;
        }
        String trimmed = content.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}
