package racingline.domain.track;

public enum TurnDirection {
    LEFT,
    RIGHT,
    STRAIGHT;

    public static TurnDirection fromCurvature(double curvature, double threshold) {
        if (curvature > threshold) return LEFT;
        if (curvature < -threshold) return RIGHT;
        return STRAIGHT;
    }
}
