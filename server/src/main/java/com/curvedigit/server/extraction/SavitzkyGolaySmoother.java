package com.curvedigit.server.extraction;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local least-squares polynomial smoothing over a sliding window.
 * <p>
 * Each output sample is the value at that sample of a polynomial fitted to the {@code window}
 * neighbours around it. Near the ends the window is pinned to the first or last {@code window}
 * samples instead of shrinking, so every output comes from a full fit. For an even window the
 * sample sits just left of the window centre.
 */
public class SavitzkyGolaySmoother {

    private final int polyOrder;
    // window length -> hat matrix rows; row p gives the weights that evaluate the fit at offset p
    private final Map<Integer, double[][]> weightCache = new ConcurrentHashMap<>();

    public SavitzkyGolaySmoother(int polyOrder) {
        if (polyOrder < 0) {
            throw new IllegalArgumentException("polyOrder must be >= 0");
        }
        this.polyOrder = polyOrder;
    }

    public int getPolyOrder() {
        return polyOrder;
    }

    /**
     * @return a new array of the same length; the input is not modified
     */
    public double[] smooth(double[] y, int window) {
        int n = y.length;
        if (window <= polyOrder || window > n) {
            return y.clone();
        }
        double[][] weights = weightCache.computeIfAbsent(window, this::hatMatrix);
        int left = (window - 1) / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            int start = Math.max(0, Math.min(i - left, n - window));
            double[] w = weights[i - start];
            double acc = 0.0;
            for (int j = 0; j < window; j++) {
                acc += w[j] * y[start + j];
            }
            out[i] = acc;
        }
        return out;
    }

    /**
     * H = Q1 Q1^T, where Q1 spans the columns of the centred Vandermonde matrix of the window.
     */
    private double[][] hatMatrix(int window) {
        int cols = polyOrder + 1;
        double center = (window - 1) / 2.0;
        double scale = Math.max(1.0, center);
        double[][] a = new double[window][cols];
        for (int i = 0; i < window; i++) {
            double t = (i - center) / scale;
            double v = 1.0;
            for (int k = 0; k < cols; k++) {
                a[i][k] = v;
                v *= t;
            }
        }
        RealMatrix q = new QRDecomposition(new Array2DRowRealMatrix(a, false)).getQ();
        double[][] h = new double[window][window];
        for (int p = 0; p < window; p++) {
            for (int j = 0; j < window; j++) {
                double s = 0.0;
                for (int k = 0; k < cols; k++) {
                    s += q.getEntry(p, k) * q.getEntry(j, k);
                }
                h[p][j] = s;
            }
        }
        return h;
    }
}
