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

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.List;

/**
 * Dense matrix helpers for penalized least-squares smoothing.  General algebra (multiply, add, transpose) comes from
 * commons-math's RealMatrix; this class builds the specific operators the baseline fit needs.
 */
public final class Matrices {

  private Matrices() {
  }

  public static RealMatrix create(int rows, int cols) {
    return new Array2DRowRealMatrix(rows, cols);
  }

  public static RealMatrix diagonal(double[] values) {
    Validate.isTrue(values != null && values.length > 0, "Diagonal matrix needs at least one value");
    return MatrixUtils.createRealDiagonalMatrix(values);
  }

  /**
   * Builds the finite-difference operator D of shape (n - order, n).
   *   order 1: rows of [-1, 1]
   *   order 2: rows of [1, -2, 1]
   * @param n The number of samples the operator acts on.
   * @param order 1 or 2.
   * @return The difference matrix.
   */
  public static RealMatrix differenceOperator(int n, int order) {
    Validate.isTrue(order == 1 || order == 2, "Only first and second order differences are supported, got %d", order);
    Validate.isTrue(n > order, "Need more than %d samples for an order %d difference, got %d", order, order, n);

    RealMatrix d = new Array2DRowRealMatrix(n - order, n);
    for (int i = 0; i < n - order; i++) {
      if (order == 1) {
        d.setEntry(i, i, -1.0);
        d.setEntry(i, i + 1, 1.0);
      } else {
        d.setEntry(i, i, 1.0);
        d.setEntry(i, i + 1, -2.0);
        d.setEntry(i, i + 2, 1.0);
      }
    }
    return d;
  }

  /**
   * Computes the Gram matrix DᵀD.  Difference operators are banded, so each row only contributes the outer product
   * of its non-zero entries; this keeps the cost linear in the number of rows instead of cubic in n.
   */
  public static RealMatrix gram(RealMatrix d) {
    int cols = d.getColumnDimension();
    RealMatrix g = new Array2DRowRealMatrix(cols, cols);
    List<Integer> nonZero = new ArrayList<>();
    for (int r = 0; r < d.getRowDimension(); r++) {
      nonZero.clear();
      double[] row = d.getRow(r);
      for (int c = 0; c < cols; c++) {
        if (row[c] != 0.0) {
          nonZero.add(c);
        }
      }
      for (int a : nonZero) {
        for (int b : nonZero) {
          g.addToEntry(a, b, row[a] * row[b]);
        }
      }
    }
    return g;
  }

  /**
   * Builds the system matrix W + λ·P where W = diag(weights).
   */
  public static RealMatrix penalized(double[] weights, double lambda, RealMatrix penalty) {
    Validate.isTrue(penalty.isSquare(), "Penalty matrix must be square");
    Validate.isTrue(weights.length == penalty.getRowDimension(),
        "Weight count %d does not match penalty dimension %d", weights.length, penalty.getRowDimension());

    RealMatrix a = penalty.scalarMultiply(lambda);
    for (int i = 0; i < weights.length; i++) {
      a.addToEntry(i, i, weights[i]);
    }
    return a;
  }
}
