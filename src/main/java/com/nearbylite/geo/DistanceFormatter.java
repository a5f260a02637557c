package com.nearbylite.geo;

import java.util.Locale;

/**
 * Display text for a distance: "{@code 512 m}" below one kilometre, "{@code 1.1 km}" from there on.
 */
public final class DistanceFormatter {

    public static final String UNKNOWN = "--";

    public static String format(double distanceMeters) {
        if (Double.isNaN(distanceMeters)) return UNKNOWN;
        if (distanceMeters < 1000.0) {
            return Math.round(distanceMeters) + " m";
        }
        return String.format(Locale.ROOT, "%.1f km", distanceMeters / 1000.0);
    }

    private DistanceFormatter() {}
}
