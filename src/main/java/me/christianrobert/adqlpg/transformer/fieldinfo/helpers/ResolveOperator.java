package me.christianrobert.adqlpg.transformer.fieldinfo.helpers;

import me.christianrobert.adqlpg.transformer.fieldinfo.AnnotationContext;
import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfo;
import me.christianrobert.adqlpg.transformer.fieldinfo.StcFrames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Static helper for the metadata of operator expressions.
 *
 * <p>Handles:</p>
 * <ul>
 *   <li>Multiplication and division (*, /)</li>
 *   <li>Addition and subtraction (+, -)</li>
 *   <li>String concatenation (||)</li>
 * </ul>
 *
 * <p>Operands are combined left to right; the STC of every step goes through
 * {@link StcFrames#combine}.</p>
 */
public final class ResolveOperator {

    private static final Logger log = LoggerFactory.getLogger(ResolveOperator.class);

    private ResolveOperator() {
        // Static utility class - prevent instantiation
    }

    /**
     * Folds a term (factors joined by * and /).
     */
    public static FieldInfo multiplicative(List<FieldInfo> operands, List<String> operators,
                                           AnnotationContext context) {
        FieldInfo result = operands.get(0);
        for (int i = 0; i < operators.size(); i++) {
            result = multiply(operators.get(i), result, operands.get(i + 1), context);
        }
        return result;
    }

    /**
     * Folds a numeric value expression (terms joined by + and -).
     */
    public static FieldInfo additive(List<FieldInfo> operands, AnnotationContext context) {
        FieldInfo result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = add(result, operands.get(i), context);
        }
        return result;
    }

    /**
     * String concatenations are dimensionless and tainted.
     */
    public static FieldInfo concatenation(List<FieldInfo> operands) {
        return new FieldInfo("", "", null, true, FieldInfo.collectUserData(operands));
    }

    /**
     * Metadata of {@code fi1 operator fi2} for * and /.
     *
     * <p>Rules:</p>
     * <ul>
     *   <li>dimensionless * dimensionless → dimensionless</li>
     *   <li>one side dimensionless → the other side's unit and UCD, tainted</li>
     *   <li>otherwise → unit {@code u1*u2} or {@code u1/u2} (compound divisors in
     *       parentheses), no UCD, taint of the operands</li>
     * </ul>
     */
    public static FieldInfo multiply(String operator, FieldInfo fi1, FieldInfo fi2, AnnotationContext context) {
        List<String> userData = FieldInfo.collectUserData(List.of(fi1, fi2));
        String stc = combineStc(fi1, fi2, context);
        boolean dimless1 = isDimensionless(fi1);
        boolean dimless2 = isDimensionless(fi2);

        if (dimless1 && dimless2) {
            return new FieldInfo("", "", stc, fi1.isTainted() || fi2.isTainted(), userData);
        }
        if (dimless1) {
            return new FieldInfo(fi2.getUnit(), fi2.getUcd(), stc, true, userData);
        }
        if (dimless2) {
            return new FieldInfo(fi1.getUnit(), fi1.getUcd(), stc, true, userData);
        }

        String unit;
        if ("/".equals(operator)) {
            unit = fi1.getUnit() + "/" + parenthesize(fi2.getUnit());
        } else {
            unit = fi1.getUnit() + "*" + fi2.getUnit();
        }
        log.trace("Combined units {} {} {} to {}", fi1.getUnit(), operator, fi2.getUnit(), unit);
        return new FieldInfo(unit, "", stc, fi1.isTainted() || fi2.isTainted(), userData);
    }

    /**
     * Metadata of {@code fi1 +/- fi2}.
     *
     * <p>Rules:</p>
     * <ul>
     *   <li>equal unit and equal UCD → kept; tainted only if an operand is</li>
     *   <li>otherwise → no unit, no UCD, tainted</li>
     * </ul>
     */
    public static FieldInfo add(FieldInfo fi1, FieldInfo fi2, AnnotationContext context) {
        List<String> userData = FieldInfo.collectUserData(List.of(fi1, fi2));
        String stc = combineStc(fi1, fi2, context);
        if (fi1.getUnit().equals(fi2.getUnit()) && fi1.getUcd().equals(fi2.getUcd())) {
            return new FieldInfo(fi1.getUnit(), fi1.getUcd(), stc, fi1.isTainted() || fi2.isTainted(), userData);
        }
        return new FieldInfo("", "", stc, true, userData);
    }

    /**
     * STC of a combined value; a conflict is reported as a warning.
     */
    public static String combineStc(FieldInfo fi1, FieldInfo fi2, AnnotationContext context) {
        String combined = StcFrames.combine(fi1.getStc(), fi2.getStc());
        if (StcFrames.BROKEN.equals(combined)
                && !StcFrames.BROKEN.equals(fi1.getStc()) && !StcFrames.BROKEN.equals(fi2.getStc())
                && context != null) {
            context.addWarning("Ambiguous STC info: combining values in " + fi1.getStc()
                    + " and " + fi2.getStc());
        }
        return combined;
    }

    private static boolean isDimensionless(FieldInfo info) {
        return info.getUnit().isEmpty() && info.getUcd().isEmpty();
    }

    private static String parenthesize(String unit) {
        if (unit.contains("*") || unit.contains("/")) {
            return "(" + unit + ")";
        }
        return unit;
    }
}
