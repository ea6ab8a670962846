package org.carma.deception.safety;

import org.carma.deception.model.*;

import java.util.*;

/**
 * Structural and range checks on {@link EquilibriumParams}, run before any iteration.
 *
 * Validates:
 * - Sizes N, D, M within the service limits
 * - Budgets: one per player, finite, in [0, MAX_POWER]
 * - σ² strictly positive (keeps every SINR denominator away from zero)
 * - τ, α, ε, iteration cap and K within range
 * - Gain matrices exactly D×N and M×N, finite and non-negative
 * - Channel layout of length N with owners in [0, D)
 * - Strategy, objective and attacker mode present
 *
 * Every problem is reported with the offending field; nothing is fixed up silently.
 */
public class ParameterValidator {

    public static final int MAX_CHANNELS = 100;
    public static final int MAX_DEFENDERS = 20;
    public static final int MAX_ATTACKERS = 20;
    public static final int MAX_ITERATIONS = 1000;
    public static final double MAX_POWER = 10000;
    public static final double MIN_NOISE = 0.0001;
    public static final double MIN_DAMPING = 0.01;
    public static final double MIN_EPSILON = 0.0000001;

    /**
     * Result of parameter validation.
     */
    public static class ValidationResult {
        private final List<ValidationError> errors;

        public ValidationResult(List<ValidationError> errors) {
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        }

        public boolean isValid() { return errors.isEmpty(); }
        public List<ValidationError> getErrors() { return errors; }

        @Override
        public String toString() {
            return isValid() ? "VALID" : "INVALID (" + errors.size() + " errors)";
        }
    }

    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    // ========================================================================
    // ENTRY POINTS
    // ========================================================================

    public ValidationResult validate(EquilibriumParams params) {
        List<ValidationError> errors = new ArrayList<>();
        if (params == null) {
            errors.add(new ValidationError("params", "must not be null"));
            return new ValidationResult(errors);
        }

        validateSizes(params, errors);
        validateScalars(params, errors);
        validateBudgets(params, errors);
        validateGains(params, errors);
        validateChannels(params, errors);
        validateEnums(params, errors);

        return new ValidationResult(errors);
    }

    /**
     * @throws InvalidParametersException listing every failed field
     */
    public void validateOrThrow(EquilibriumParams params) {
        ValidationResult result = validate(params);
        if (!result.isValid()) {
            throw new InvalidParametersException(result.getErrors());
        }
    }

    // ========================================================================
    // CHECKS
    // ========================================================================

    private void validateSizes(EquilibriumParams p, List<ValidationError> errors) {
        checkRange(errors, "N", p.getNumChannels(), 1, MAX_CHANNELS);
        checkRange(errors, "D", p.getNumDefenders(), 1, MAX_DEFENDERS);
        checkRange(errors, "M", p.getNumAttackers(), 1, MAX_ATTACKERS);
    }

    private void validateScalars(EquilibriumParams p, List<ValidationError> errors) {
        checkRange(errors, "sigma2", p.getNoisePower(), MIN_NOISE, MAX_POWER);
        checkRange(errors, "tau", p.getSensingThreshold(), 0, MAX_POWER);
        checkRange(errors, "alpha", p.getDamping(), MIN_DAMPING, 1);
        checkRange(errors, "maxIter", p.getMaxIterations(), 1, MAX_ITERATIONS);
        checkRange(errors, "epsilon", p.getEpsilon(), MIN_EPSILON, 1);
        if (p.getJammerStrategy() == JammerStrategy.TOP_K || p.getTopK() != 0) {
            checkRange(errors, "topK", p.getTopK(), 1, MAX_CHANNELS);
        }
    }

    private void validateBudgets(EquilibriumParams p, List<ValidationError> errors) {
        checkBudgetArray(errors, "PT", p.getDefenderBudgets(), p.getNumDefenders());
        checkBudgetArray(errors, "PJ", p.getAttackerBudgets(), p.getNumAttackers());
    }

    private void validateGains(EquilibriumParams p, List<ValidationError> errors) {
        checkGainMatrix(errors, "h", p.getDefenderGains(), p.getNumDefenders(), p.getNumChannels());
        checkGainMatrix(errors, "g", p.getAttackerGains(), p.getNumAttackers(), p.getNumChannels());
    }

    private void validateChannels(EquilibriumParams p, List<ValidationError> errors) {
        List<ChannelConfig> channels = p.getChannels();
        if (channels.size() != p.getNumChannels()) {
            errors.add(new ValidationError("channelConfig",
                "length " + channels.size() + " does not match N=" + p.getNumChannels()));
        }
        for (int i = 0; i < channels.size(); i++) {
            ChannelConfig c = channels.get(i);
            String field = "channelConfig[" + i + "]";
            if (c == null) {
                errors.add(new ValidationError(field, "must not be null"));
                continue;
            }
            if (c.getType() == null) {
                errors.add(new ValidationError(field + ".type", "must be real, decoy, or inactive"));
            }
            if (c.getOwner() < 0 || c.getOwner() >= p.getNumDefenders()) {
                errors.add(new ValidationError(field + ".owner",
                    "must be between 0 and " + (p.getNumDefenders() - 1) + ", got " + c.getOwner()));
            }
        }
    }

    private void validateEnums(EquilibriumParams p, List<ValidationError> errors) {
        if (p.getJammerStrategy() == null) {
            errors.add(new ValidationError("jammerStrategy", "must be uniform, topK, or gradient"));
        }
        if (p.getJammerObjective() == null) {
            errors.add(new ValidationError("jammerObjective", "must be deception or oracle"));
        }
        if (p.getAttackerMode() == null) {
            errors.add(new ValidationError("attackerMode", "must be coordinated or independent"));
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void checkRange(List<ValidationError> errors, String field, double value,
                            double min, double max) {
        if (!Double.isFinite(value)) {
            errors.add(new ValidationError(field, "must be a finite number"));
        } else if (value < min || value > max) {
            errors.add(new ValidationError(field, "must be between " + format(min) + " and " + format(max)
                + ", got " + format(value)));
        }
    }

    private void checkBudgetArray(List<ValidationError> errors, String field, double[] values, int expected) {
        if (values == null) {
            errors.add(new ValidationError(field, "must be an array of length " + expected));
            return;
        }
        if (values.length != expected) {
            errors.add(new ValidationError(field,
                "length " + values.length + " does not match player count " + expected));
        }
        for (int k = 0; k < values.length; k++) {
            checkRange(errors, field + "[" + k + "]", values[k], 0, MAX_POWER);
        }
    }

    private void checkGainMatrix(List<ValidationError> errors, String field, double[][] matrix,
                                 int rows, int cols) {
        if (matrix == null) {
            errors.add(new ValidationError(field, "must be a " + rows + "x" + cols + " matrix"));
            return;
        }
        if (matrix.length != rows) {
            errors.add(new ValidationError(field, "has " + matrix.length + " rows, expected " + rows));
        }
        for (int r = 0; r < matrix.length; r++) {
            double[] row = matrix[r];
            String rowField = field + "[" + r + "]";
            if (row == null) {
                errors.add(new ValidationError(rowField, "must not be null"));
                continue;
            }
            if (row.length != cols) {
                errors.add(new ValidationError(rowField, "has " + row.length + " entries, expected " + cols));
            }
            for (int c = 0; c < row.length; c++) {
                if (!Double.isFinite(row[c]) || row[c] < 0) {
                    errors.add(new ValidationError(rowField + "[" + c + "]",
                        "must be a non-negative finite number, got " + row[c]));
                }
            }
        }
    }

    private static String format(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return String.valueOf((long) v);
        }
        return String.valueOf(v);
    }
}
