package racingline.factory;

import racingline.domain.dto.TrackPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Generadores de pistas sintéticas: el circuito circular de muestra del catálogo y
 * pistas de referencia para pruebas.
 */
public class SampleTrackFactory {

    private SampleTrackFactory() {}

    /**
     * Circunferencia centrada en el origen recorrida en sentido antihorario.
     * El último punto repite el primero (ángulo 2π).
     */
    public static List<TrackPoint> circle(double radius, int pointCount) {
        List<TrackPoint> points = new ArrayList<>(pointCount);
        for (int i = 0; i < pointCount; i++) {
            double angle = 2.0 * Math.PI * i / (pointCount - 1);
            points.add(new TrackPoint(radius * Math.cos(angle), radius * Math.sin(angle)));
        }
        return points;
    }

    /**
     * Rectángulo con esquinas vivas de 90°, recorrido en sentido antihorario desde (0, 0).
     *
     * @param spacing distancia aproximada entre puntos consecutivos de cada lado.
     */
    public static List<TrackPoint> rectangle(double width, double height, double spacing) {
        double[][] corners = {{0, 0}, {width, 0}, {width, height}, {0, height}};
        List<TrackPoint> points = new ArrayList<>();
        for (int c = 0; c < corners.length; c++) {
            double[] from = corners[c];
            double[] to = corners[(c + 1) % corners.length];
            double sideLength = Math.hypot(to[0] - from[0], to[1] - from[1]);
            int steps = Math.max(1, (int) Math.round(sideLength / spacing));
            for (int k = 0; k < steps; k++) {
                double t = (double) k / steps;
                points.add(new TrackPoint(from[0] + t * (to[0] - from[0]), from[1] + t * (to[1] - from[1])));
            }
        }
        return points;
    }
}
