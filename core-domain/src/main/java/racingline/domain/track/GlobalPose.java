package racingline.domain.track;

/** Posición cartesiana y rumbo absoluto (radianes). */
public record GlobalPose(double x, double y, double heading) {
}
