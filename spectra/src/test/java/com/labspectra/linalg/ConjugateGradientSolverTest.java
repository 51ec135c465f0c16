/*************************************************************************
*                                                                        *
*  This file is part of the labspectra project.                          *
*  labspectra corrects baselines, picks and integrates spectral peaks.   *
*  Copyright (C) 2026 labspectra contributors                            *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.labspectra.linalg;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ConjugateGradientSolverTest {

  @Test
  public void testSolvesSmallSymmetricPositiveDefiniteSystem() {
    RealMatrix a = new Array2DRowRealMatrix(new double[][]{{4.0, 1.0}, {1.0, 3.0}});
    RealVector b = new ArrayRealVector(new double[]{1.0, 2.0});
    RealVector x = new ConjugateGradientSolver().solve(a, b);
    assertArrayEquals("CG converges to the exact solution in n steps",
        new double[]{1.0 / 11.0, 7.0 / 11.0}, x.toArray(), 1e-9);
  }

  @Test
  public void testSolvesPenalizedSmoothingSystem() {
    int n = 12;
    double[] weights = new double[n];
    double[] rhs = new double[n];
    for (int i = 0; i < n; i++) {
      weights[i] = 1.0;
      rhs[i] = Math.sin(i / 2.0);
    }
    RealMatrix a = Matrices.penalized(weights, 5.0, Matrices.gram(Matrices.differenceOperator(n, 2)));
    RealVector x = new ConjugateGradientSolver().solve(a, new ArrayRealVector(rhs));
    RealVector residual = a.operate(x).subtract(new ArrayRealVector(rhs));
    assertEquals("Residual is negligible", 0.0, residual.getNorm(), 1e-6);
  }

  @Test
  public void testZeroRightHandSideReturnsZeroVector() {
    RealMatrix a = new Array2DRowRealMatrix(new double[][]{{2.0, 0.0}, {0.0, 2.0}});
    RealVector x = new ConjugateGradientSolver().solve(a, new ArrayRealVector(2));
    assertArrayEquals("Nothing to solve", new double[]{0.0, 0.0}, x.toArray(), 0.0);
  }

  @Test
  public void testSingularSystemReturnsBestIterateInsteadOfThrowing() {
    RealMatrix a = new Array2DRowRealMatrix(2, 2);
    RealVector x = new ConjugateGradientSolver().solve(a, new ArrayRealVector(new double[]{1.0, 1.0}));
    assertArrayEquals("No curvature: starting iterate is returned", new double[]{0.0, 0.0}, x.toArray(), 0.0);
  }

  @Test
  public void testIterationCapIsRespected() {
    int n = 30;
    double[] weights = new double[n];
    double[] rhs = new double[n];
    for (int i = 0; i < n; i++) {
      weights[i] = 0.01;
      rhs[i] = i % 3;
    }
    RealMatrix a = Matrices.penalized(weights, 1e5, Matrices.gram(Matrices.differenceOperator(n, 2)));
    RealVector x = new ConjugateGradientSolver(1).solve(a, new ArrayRealVector(rhs));
    assertEquals("Solution has the system dimension", n, x.getDimension());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDimensionMismatchIsRejected() {
    new ConjugateGradientSolver().solve(new Array2DRowRealMatrix(3, 3), new ArrayRealVector(2));
  }
}
