/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.calx.poly;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Numerical root finding for polynomials of any degree. */
class RootFinder {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(RootFinder.class);

  private RootFinder() {}

  /**
   * Finds all complex roots of a polynomial by the Durand-Kerner
   * (Weierstrass) iteration.
   *
   * <p>Each root is returned as a two-element array {@code {re, im}}.
   *
   * @throws ArithmeticException if the largest correction is not below
   *   {@code tolerance} (relative to the root's magnitude) within
   *   {@code maxIterations} iterations
   */
  static List<double[]> durandKerner(Polynomial p, int maxIterations,
      double tolerance) {
    final int n = p.degree();
    final double leadRe = p.leadingCoefficient().doubleValue();
    final double leadIm = p.leadingCoefficient().imaginaryValue();
    final double leadNorm = leadRe * leadRe + leadIm * leadIm;

    // Monic coefficients, ascending
    final double[] re = new double[n + 1];
    final double[] im = new double[n + 1];
    for (int i = 0; i <= n; i++) {
      final double cr = p.coefficient(i).doubleValue();
      final double ci = p.coefficient(i).imaginaryValue();
      re[i] = (cr * leadRe + ci * leadIm) / leadNorm;
      im[i] = (ci * leadRe - cr * leadIm) / leadNorm;
    }

    // Initial guesses are powers of 0.4 + 0.9i, which is neither real nor a
    // root of unity
    final double[] zr = new double[n];
    final double[] zi = new double[n];
    double gr = 1d;
    double gi = 0d;
    for (int k = 0; k < n; k++) {
      zr[k] = gr;
      zi[k] = gi;
      final double t = gr * 0.4d - gi * 0.9d;
      gi = gr * 0.9d + gi * 0.4d;
      gr = t;
    }

    for (int iteration = 0; iteration < maxIterations; iteration++) {
      double maxDelta = 0d;
      for (int i = 0; i < n; i++) {
        // Evaluate the monic polynomial at z[i] by Horner's method
        double pr = re[n];
        double pi = im[n];
        for (int j = n - 1; j >= 0; j--) {
          final double t = pr * zr[i] - pi * zi[i] + re[j];
          pi = pr * zi[i] + pi * zr[i] + im[j];
          pr = t;
        }
        // Product of differences from the other estimates
        double dr = 1d;
        double di = 0d;
        for (int j = 0; j < n; j++) {
          if (j != i) {
            final double ar = zr[i] - zr[j];
            final double ai = zi[i] - zi[j];
            final double t = dr * ar - di * ai;
            di = dr * ai + di * ar;
            dr = t;
          }
        }
        final double norm = dr * dr + di * di;
        if (norm == 0d) {
          // Two estimates collided; nudge one apart
          zr[i] += tolerance;
          zi[i] += tolerance;
          maxDelta = Double.MAX_VALUE;
          continue;
        }
        final double deltaRe = (pr * dr + pi * di) / norm;
        final double deltaIm = (pi * dr - pr * di) / norm;
        zr[i] -= deltaRe;
        zi[i] -= deltaIm;
        final double scale = Math.max(1d, Math.hypot(zr[i], zi[i]));
        maxDelta = Math.max(maxDelta, Math.hypot(deltaRe, deltaIm) / scale);
      }
      if (maxDelta < tolerance) {
        LOGGER.debug("Durand-Kerner converged for degree {} after {} "
            + "iterations", n, iteration + 1);
        final List<double[]> roots = new ArrayList<>();
        for (int k = 0; k < n; k++) {
          roots.add(new double[] {zr[k], zi[k]});
        }
        return roots;
      }
    }
    throw new ArithmeticException("Root finding did not converge after "
        + maxIterations + " iterations");
  }
}

// End RootFinder.java
