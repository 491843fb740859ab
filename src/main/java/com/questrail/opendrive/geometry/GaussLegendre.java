package com.questrail.opendrive.geometry;

import java.util.function.DoubleUnaryOperator;

/**
 * Composite five-point Gauss-Legendre quadrature.
 *
 * <p>Five nodes integrate polynomials up to degree nine exactly per panel, so the
 * smooth integrands produced by spirals and cubic curves converge quickly as the
 * panel count grows.</p>
 */
final class GaussLegendre
{
    private static final double[] NODES = {
            0.0,
            -0.5384693101056831,
            0.5384693101056831,
            -0.9061798459386640,
            0.9061798459386640
    };

    private static final double[] WEIGHTS = {
            0.5688888888888889,
            0.4786286704993665,
            0.4786286704993665,
            0.2369268850561891,
            0.2369268850561891
    };

    static final int MAX_PANELS = 4096;

    private GaussLegendre() {
    }

    static double integrate(DoubleUnaryOperator f, double from, double to, int panels) {
        if (from == to) {
            return 0.0;
        }
        int n = Math.max(1, Math.min(panels, MAX_PANELS));
        double h = (to - from) / n;
        double half = h / 2.0;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            double mid = from + (i + 0.5) * h;
            double panel = 0.0;
            for (int k = 0; k < NODES.length; k++) {
                panel += WEIGHTS[k] * f.applyAsDouble(mid + half * NODES[k]);
            }
            sum += panel * half;
        }
        return sum;
    }

    /**
     * Panel count giving each panel at most {@code maxTurn} radians of heading
     * change and at most {@code maxSpan} meters of extent.
     */
    static int panelsFor(double extent, double totalTurn, double maxTurn, double maxSpan) {
        double byTurn = Math.ceil(Math.abs(totalTurn) / maxTurn);
        double bySpan = Math.ceil(Math.abs(extent) / maxSpan);
        double panels = Math.max(1.0, Math.max(byTurn, bySpan));
        return panels >= MAX_PANELS ? MAX_PANELS : (int) panels;
    }
}
