package me.christianrobert.adqlpg.transformer.fieldinfo.helpers;

import me.christianrobert.adqlpg.transformer.fieldinfo.AnnotationContext;
import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfo;
import me.christianrobert.adqlpg.transformer.fieldinfo.StcFrames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for the metadata of geometries and geometry functions.
 *
 * <p>Geometry values have no UCD; their unit is the comma-separated list of
 * their coordinate units (e.g. {@code deg,deg} for a point), their STC the
 * frame named in the coordinate system literal.</p>
 */
public final class ResolveGeometry {

    private static final Logger log = LoggerFactory.getLogger(ResolveGeometry.class);

    private ResolveGeometry() {
        // Static utility class - prevent instantiation
    }

    /**
     * Metadata of a geometry constructor. Arguments carrying STC that does not fit
     * the frame are reported as errors on the context.
     *
     * @param shape POINT, CIRCLE, BOX or POLYGON
     * @param frame frame of the coordinate system literal, null if not a literal
     * @param arguments metadata of the numeric arguments
     */
    public static FieldInfo constructor(String shape, String frame, List<FieldInfo> arguments,
                                        AnnotationContext context) {
        List<String> units = new ArrayList<>();
        boolean anyUnit = false;
        for (int i = 0; i < arguments.size(); i++) {
            FieldInfo argument = arguments.get(i);
            units.add(argument.getUnit());
            anyUnit |= !argument.getUnit().isEmpty();
            if (argument.getStc() != null && !StcFrames.isCompatible(argument.getStc(), frame)) {
                context.addError("When constructing " + shape + ": Argument " + (i + 1)
                        + " has incompatible STC");
            }
        }
        String unit = anyUnit ? String.join(",", units) : "";
        return new FieldInfo(unit, "", frame, false, FieldInfo.collectUserData(arguments));
    }

    /**
     * CONTAINS and INTERSECTS are dimensionless; differing frames give a warning.
     */
    public static FieldInfo predicate(String functionName, FieldInfo arg1, FieldInfo arg2,
                                      AnnotationContext context) {
        if (!StcFrames.isCompatible(arg1.getStc(), arg2.getStc())) {
            log.debug("{} on frames {} and {}", functionName, arg1.getStc(), arg2.getStc());
            context.addWarning("In " + functionName + ": Argument systems are not compatible");
        }
        return FieldInfo.DIMENSIONLESS;
    }

    public static FieldInfo distance(FieldInfo arg1, FieldInfo arg2) {
        return new FieldInfo("deg", "pos.angDistance", null, false,
                FieldInfo.collectUserData(List.of(arg1, arg2)));
    }

    public static FieldInfo area(FieldInfo argument) {
        return new FieldInfo("deg**2", "phys.angArea", null, false, argument.getUserData());
    }

    public static FieldInfo coordSys() {
        return FieldInfo.of("", "meta.ref;pos.frame");
    }

    /**
     * COORD1 and COORD2 take the unit of the respective coordinate of their point.
     * If the point was built from exactly two columns, the user data of the
     * respective column is kept.
     *
     * @param index 0 for COORD1, 1 for COORD2
     */
    public static FieldInfo coordinate(int index, FieldInfo point) {
        String[] units = point.getUnit().split(",", -1);
        String unit = index < units.length ? units[index] : "";
        List<String> userData = point.getUserData().size() == 2
                ? List.of(point.getUserData().get(index))
                : List.of();
        return new FieldInfo(unit, "", null, false, userData);
    }
}
