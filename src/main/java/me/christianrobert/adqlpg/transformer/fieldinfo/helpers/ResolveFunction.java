package me.christianrobert.adqlpg.transformer.fieldinfo.helpers;

import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfo;
import me.christianrobert.adqlpg.transformer.ufunc.UserFunction;
import me.christianrobert.adqlpg.transformer.ufunc.UserFunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static helper for the metadata of function calls.
 *
 * <p>Aggregates:</p>
 * <ul>
 *   <li>COUNT, COUNT(*) → no unit, UCD meta.number</li>
 *   <li>SUM → unit kept, UCD dropped</li>
 *   <li>AVG, MIN, MAX → unit kept, UCD prefixed with stat.mean, stat.min, stat.max</li>
 * </ul>
 *
 * <p>Numeric functions see {@link #numericFunction}.</p>
 */
public final class ResolveFunction {

    private static final Logger log = LoggerFactory.getLogger(ResolveFunction.class);

    private static final Map<String, String> STAT_UCDS = Map.of(
            "AVG", "stat.mean",
            "MIN", "stat.min",
            "MAX", "stat.max");

    private static final Set<String> KEEPS_METADATA = Set.of(
            "ABS", "CEILING", "FLOOR", "ROUND", "TRUNCATE", "MOD");

    private static final Set<String> RETURNS_RADIANS = Set.of(
            "ACOS", "ASIN", "ATAN", "ATAN2");

    private ResolveFunction() {
        // Static utility class - prevent instantiation
    }

    /**
     * Metadata of an aggregate call.
     *
     * @param functionName upper case AVG, MIN, MAX, SUM or COUNT
     * @param argument metadata of the aggregated expression, null for COUNT(*)
     */
    public static FieldInfo setFunction(String functionName, FieldInfo argument) {
        if ("COUNT".equals(functionName)) {
            List<String> userData = argument == null ? List.of() : argument.getUserData();
            return new FieldInfo("", "meta.number", null, false, userData);
        }
        if ("SUM".equals(functionName)) {
            return argument.withUcd("");
        }
        String prefix = STAT_UCDS.get(functionName);
        if (prefix == null) {
            log.debug("Unknown aggregate {}, keeping argument metadata", functionName);
            return argument;
        }
        String ucd = argument.getUcd().isEmpty() ? prefix : prefix + ";" + argument.getUcd();
        return argument.withUcd(ucd);
    }

    /**
     * Metadata of a numeric or trig function call.
     *
     * <p>Rules:</p>
     * <ul>
     *   <li>ABS, CEILING, FLOOR, ROUND, TRUNCATE, MOD → metadata of the first argument</li>
     *   <li>DEGREES, RADIANS → deg or rad, UCD of the argument</li>
     *   <li>inverse trig functions → rad</li>
     *   <li>everything else → dimensionless</li>
     * </ul>
     * User data is collected from all arguments; the result is tainted if an argument is.
     */
    public static FieldInfo numericFunction(String functionName, List<FieldInfo> arguments) {
        List<String> userData = FieldInfo.collectUserData(arguments);
        boolean tainted = FieldInfo.anyTainted(arguments);
        FieldInfo first = arguments.isEmpty() ? FieldInfo.DIMENSIONLESS : arguments.get(0);

        if ("DEGREES".equals(functionName)) {
            return new FieldInfo("deg", first.getUcd(), null, tainted, userData);
        }
        if ("RADIANS".equals(functionName)) {
            return new FieldInfo("rad", first.getUcd(), null, tainted, userData);
        }
        if (KEEPS_METADATA.contains(functionName)) {
            return new FieldInfo(first.getUnit(), first.getUcd(), first.getStc(), tainted, userData);
        }
        if (RETURNS_RADIANS.contains(functionName)) {
            return new FieldInfo("rad", "", null, tainted, userData);
        }
        return new FieldInfo("", "", null, tainted, userData);
    }

    /**
     * Metadata of a user defined function: unit and UCD as declared in the registry.
     */
    public static FieldInfo userFunction(String functionName, List<FieldInfo> arguments,
                                         UserFunctionRegistry registry) {
        List<String> userData = FieldInfo.collectUserData(arguments);
        if (registry == null || !registry.isKnown(functionName)) {
            return new FieldInfo("", "", null, false, userData);
        }
        UserFunction function = registry.lookup(functionName);
        return new FieldInfo(function.getUnit(), function.getUcd(), null, false, userData);
    }
}
