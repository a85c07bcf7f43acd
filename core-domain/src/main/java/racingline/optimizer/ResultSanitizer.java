package racingline.optimizer;

import racingline.domain.dto.VehicleResult;

/**
 * Sustituye cualquier NaN o infinito de un resultado por 0.0 antes de devolverlo.
 */
public final class ResultSanitizer {

    private ResultSanitizer() {}

    public static VehicleResult sanitize(VehicleResult result) {
        double[][] coordinates = new double[result.coordinates().length][];
        for (int i = 0; i < coordinates.length; i++) {
            coordinates[i] = sanitize(result.coordinates()[i]);
        }
        return VehicleResult.builder()
                .vehicleId(result.vehicleId())
                .modelId(result.modelId())
                .coordinates(coordinates)
                .speeds(sanitize(result.speeds()))
                .lapTime(sanitize(result.lapTime()))
                .fallback(result.fallback())
                .build();
    }

    public static double[] sanitize(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = sanitize(values[i]);
        }
        return out;
    }

    public static double sanitize(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
