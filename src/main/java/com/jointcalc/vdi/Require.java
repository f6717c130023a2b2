package com.jointcalc.vdi;

import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.JointCalculationException;
import com.jointcalc.model.Stage;

import java.util.Locale;

/**
 * Argument checks shared by the stage functions. Each failed check names the
 * stage and the field it rejects.
 */
final class Require {
    private Require() {
    }

    static void positive(double value, ErrorKind kind, Stage stage, String field) {
        if (!(value > 0.0))
            throw new JointCalculationException(kind, stage, field,
                    field + " must be > 0, was " + fmt(value));
    }

    static void nonNegative(double value, ErrorKind kind, Stage stage, String field) {
        if (!(value >= 0.0))
            throw new JointCalculationException(kind, stage, field,
                    field + " must be >= 0, was " + fmt(value));
    }

    static void openUnitInterval(double value, ErrorKind kind, Stage stage, String field) {
        if (!(value > 0.0 && value < 1.0))
            throw new JointCalculationException(kind, stage, field,
                    field + " must be in (0, 1), was " + fmt(value));
    }

    static double finitePositiveResult(double value, Stage stage, String quantity) {
        if (!Double.isFinite(value) || value <= 0.0)
            throw new JointCalculationException(ErrorKind.INVALID_GEOMETRY, stage, quantity,
                    quantity + " evaluated to " + fmt(value));
        return value;
    }

    static String fmt(double value) {
        return String.format(Locale.ROOT, "%.6g", value);
    }
}
