package racingline.utils;

/**
 * Utilidades de indexado para señales definidas sobre un circuito cerrado.
 * <p>
 * Convención del proyecto: un array "cerrado" repite el primer elemento al final
 * (longitud m + 1); un array "abierto" contiene solo los m puntos distintos del bucle.
 */
public final class ClosedLoops {

    private ClosedLoops() {}

    /** Índice cíclico dentro de un bucle de tamaño {@code size}. */
    public static int wrap(int index, int size) {
        int r = index % size;
        return r < 0 ? r + size : r;
    }

    /** Quita el punto duplicado de cierre. */
    public static double[] open(double[] closed) {
        if (closed.length < 2) {
            throw new IllegalArgumentException("Un array cerrado necesita al menos 2 elementos.");
        }
        double[] out = new double[closed.length - 1];
        System.arraycopy(closed, 0, out, 0, out.length);
        return out;
    }

    /** Añade el primer elemento al final, forzando el invariante de cierre. */
    public static double[] close(double[] open) {
        double[] out = new double[open.length + 1];
        System.arraycopy(open, 0, out, 0, open.length);
        out[open.length] = open[0];
        return out;
    }

    /** Desplaza la señal {@code shift} posiciones hacia adelante (los valores se mueven a índices mayores). */
    public static double[] roll(double[] open, int shift) {
        int n = open.length;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[wrap(i + shift, n)] = open[i];
        }
        return out;
    }
}
