package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.fieldinfo.StcFrames;

import java.util.Locale;
import java.util.Map;

/**
 * pgSphere rotations between celestial frames.
 * <p>
 * Each entry holds the Euler angles (radians) of {@code strans} rotating ICRS
 * into that frame. Adding the rotation goes from ICRS to the frame, subtracting
 * it goes back. Transforms between two non-ICRS frames pass through ICRS.
 * FK5 (J2000) is close enough to ICRS that no rotation is applied.
 * Angles are rendered with ten decimals.
 * </p>
 */
public final class PgSphereTransforms {

    private static final Map<String, double[]> FROM_ICRS = Map.of(
            "FK4", new double[]{1.5651864333666516, -0.0048590552804904244, -1.5763681043529187},
            "GALACTIC", new double[]{1.3463560974407338, -1.0973190018372752, 0.57477052472873258});

    private PgSphereTransforms() {
        // Static utility class - prevent instantiation
    }

    /**
     * Whether values in the two frames can be compared without a rotation.
     */
    public static boolean isNoop(String fromFrame, String toFrame) {
        return StcFrames.isUniversallyCompatible(fromFrame)
                || StcFrames.isUniversallyCompatible(toFrame)
                || normalize(fromFrame).equals(normalize(toFrame));
    }

    /**
     * Wraps {@code sql} in the rotations taking it from one frame into another.
     *
     * @return the transformed SQL, {@code sql} itself when no rotation is needed,
     *         or null when one of the frames has no known transform
     */
    public static String transform(String sql, String fromFrame, String toFrame) {
        if (isNoop(fromFrame, toFrame)) {
            return sql;
        }
        String from = normalize(fromFrame);
        String to = normalize(toFrame);
        if (!isKnown(from) || !isKnown(to)) {
            return null;
        }
        String result = sql;
        if (!"ICRS".equals(from)) {
            result = rotate(result, '-', FROM_ICRS.get(from));
        }
        if (!"ICRS".equals(to)) {
            result = rotate(result, '+', FROM_ICRS.get(to));
        }
        return result;
    }

    private static boolean isKnown(String frame) {
        return "ICRS".equals(frame) || FROM_ICRS.containsKey(frame);
    }

    private static String normalize(String frame) {
        return "FK5".equals(frame) ? "ICRS" : frame;
    }

    private static String rotate(String sql, char direction, double[] angles) {
        return String.format(Locale.ROOT, "((%s)%sstrans(%.10f, %.10f, %.10f))",
                sql, direction, angles[0], angles[1], angles[2]);
    }
}
