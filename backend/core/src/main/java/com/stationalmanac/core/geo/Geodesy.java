package com.stationalmanac.core.geo;

public final class Geodesy {
    private static final double SEMI_MAJOR_AXIS_M = 6_378_137.0;
    private static final double FLATTENING = 1 / 298.257223563;
    private static final double SEMI_MINOR_AXIS_M = SEMI_MAJOR_AXIS_M * (1 - FLATTENING);
    private static final double MEAN_RADIUS_KM = 6371.0088;

    private static final double CONVERGENCE = 1e-12;
    private static final int MAX_ITERATIONS = 200;

    private Geodesy() {
    }

    /**
     * Geodesic distance in kilometers between two points, by Vincenty's inverse formula.
     * <p>
     * Nearly antipodal pairs, where the iteration does not converge, fall back to the great-circle
     * distance on the mean-radius sphere.
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double l = Math.toRadians(lon2 - lon1);
        double u1 = Math.atan((1 - FLATTENING) * Math.tan(Math.toRadians(lat1)));
        double u2 = Math.atan((1 - FLATTENING) * Math.tan(Math.toRadians(lat2)));
        double sinU1 = Math.sin(u1);
        double cosU1 = Math.cos(u1);
        double sinU2 = Math.sin(u2);
        double cosU2 = Math.cos(u2);

        double lambda = l;
        double sinSigma;
        double cosSigma;
        double sigma;
        double cosSqAlpha;
        double cos2SigmaM;
        int iterations = 0;
        while (true) {
            double sinLambda = Math.sin(lambda);
            double cosLambda = Math.cos(lambda);
            double crossTerm = cosU1 * sinU2 - sinU1 * cosU2 * cosLambda;
            sinSigma = Math.sqrt(cosU2 * sinLambda * cosU2 * sinLambda + crossTerm * crossTerm);
            if (sinSigma == 0) {
                return 0.0;
            }
            cosSigma = sinU1 * sinU2 + cosU1 * cosU2 * cosLambda;
            sigma = Math.atan2(sinSigma, cosSigma);
            double sinAlpha = cosU1 * cosU2 * sinLambda / sinSigma;
            cosSqAlpha = 1 - sinAlpha * sinAlpha;
            // equatorial line
            cos2SigmaM = cosSqAlpha != 0 ? cosSigma - 2 * sinU1 * sinU2 / cosSqAlpha : 0;
            double c = FLATTENING / 16 * cosSqAlpha * (4 + FLATTENING * (4 - 3 * cosSqAlpha));
            double previous = lambda;
            lambda = l + (1 - c) * FLATTENING * sinAlpha
                    * (sigma + c * sinSigma * (cos2SigmaM + c * cosSigma * (-1 + 2 * cos2SigmaM * cos2SigmaM)));
            if (Math.abs(lambda - previous) <= CONVERGENCE) {
                break;
            }
            if (++iterations >= MAX_ITERATIONS) {
                return greatCircleKm(lat1, lon1, lat2, lon2);
            }
        }

        double uSq = cosSqAlpha * (SEMI_MAJOR_AXIS_M * SEMI_MAJOR_AXIS_M - SEMI_MINOR_AXIS_M * SEMI_MINOR_AXIS_M)
                / (SEMI_MINOR_AXIS_M * SEMI_MINOR_AXIS_M);
        double a = 1 + uSq / 16384 * (4096 + uSq * (-768 + uSq * (320 - 175 * uSq)));
        double b = uSq / 1024 * (256 + uSq * (-128 + uSq * (74 - 47 * uSq)));
        double deltaSigma = b * sinSigma * (cos2SigmaM + b / 4 * (cosSigma * (-1 + 2 * cos2SigmaM * cos2SigmaM)
                - b / 6 * cos2SigmaM * (-3 + 4 * sinSigma * sinSigma) * (-3 + 4 * cos2SigmaM * cos2SigmaM)));
        return SEMI_MINOR_AXIS_M * a * (sigma - deltaSigma) / 1000.0;
    }

    static double greatCircleKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * MEAN_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }
}
