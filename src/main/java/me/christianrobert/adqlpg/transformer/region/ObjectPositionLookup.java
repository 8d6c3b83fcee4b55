package me.christianrobert.adqlpg.transformer.region;

/**
 * Name resolver for astronomical objects, e.g. a client for Sesame or Simbad.
 */
@FunctionalInterface
public interface ObjectPositionLookup {

    /**
     * @return ICRS right ascension and declination in degrees, null if the object is unknown
     */
    double[] getPosition(String objectName);
}
