/*
 * Copyright (c) 2026 Seasonal Decomposition Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.seasonal.helper;

import com.google.common.base.Preconditions;

import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

import java.util.Arrays;

/**
 * Computes a multivariate linear regression (without intercept) via ordinary
 * least squares, accumulating the normal equations one observation at a time.
 *
 * <p>The periodogram feeds one observation per sample of the series, with the
 * sine and cosine regressors of the candidate period as the x values.
 */
public class LinearLeastSquares {
  public final int numX;
  public final int numY;

  private int numInputs;
  // the lower-left elements of xMat, row by row
  private final double[] xSums;
  // the elements of yMat
  private final double[] ySums;
  // the sums of y_i^2
  private final double[] y2Sums;

  // true if solver has been successfully initialized from xMat
  private boolean solved;

  private DenseMatrix64F xMat;
  private DenseMatrix64F yMat;
  private LinearSolver<DenseMatrix64F> solver;

  /**
   * Creates a solver to compute a linear least squares regression
   * with numX independent variables and numY dependent variables.
   *
   * <p>To use the solver, call addInput() at least numX times, and
   * then call getSolution() (and, optionally, getResidualSumOfSquares()).
   */
  public LinearLeastSquares(int numX, int numY) {
    Preconditions.checkArgument(numX >= 1 && numY >= 1,
        "numX and numY must be positive, got %s and %s", numX, numY);
    this.numX = numX;
    this.numY = numY;
    this.xSums = new double[numX * (numX + 1) / 2];
    this.ySums = new double[numY * numX];
    this.y2Sums = new double[numY];
  }

  // With X the (observations x numX) design matrix and Y the
  // (observations x numY) response matrix we keep
  //    xMat = transpose(X) * X
  //    yMat = transpose(X) * Y
  // and solve xMat * R = yMat for the coefficients R.
  //
  // The residual sum of squares of column k is
  //    sum(y_k^2) - dotProd(R[*, k], yMat[*, k])

  /**
   * Add one observation, using numX values from x starting with xStart and
   * numY values from y starting at yStart.
   */
  public void addInput(double[] x, int xStart, double[] y, int yStart) {
    ++numInputs;
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      double xi = x[xStart + i];
      for (int i2 = 0; i2 <= i; ++i2) {
        xSums[pos++] += xi * x[xStart + i2];
      }
    }
    for (int j = 0; j < numY; ++j) {
      double yj = y[yStart + j];
      y2Sums[j] += yj * yj;
    }
    pos = 0;
    for (int i = 0; i < numX; ++i) {
      double xi = x[xStart + i];
      for (int j = 0; j < numY; ++j) {
        ySums[pos++] += xi * y[yStart + j];
      }
    }
    solved = false;
  }

  /**
   * Compute results from the accumulated state.  Returns false if there were
   * not enough inputs or the regressors are collinear.  Returns true if it was
   * successful, and sets results to have numX rows and numY columns, where
   * each column contains the coefficients for the corresponding dependent
   * variable.
   */
  public boolean getSolution(DenseMatrix64F results) {
    if (numInputs < numX) {
      return false;
    }
    if (xMat == null) {
      xMat = new DenseMatrix64F(numX, numX);
      // yMat can just point at the ySums array without copying
      yMat = DenseMatrix64F.wrap(numX, numY, ySums);
      solver = LinearSolverFactory.symmPosDef(numX);
    }
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      for (int i2 = 0; i2 <= i; ++i2) {
        double sum = xSums[pos++];
        xMat.unsafe_set(i, i2, sum);
        if (i != i2) {
          xMat.unsafe_set(i2, i, sum);
        }
      }
    }
    solved = false;
    // the decomposition overwrites its input, so hand it a copy
    if (solver.setA(xMat.copy()) && solver.quality() > 1e-12) {
      results.reshape(numX, numY, false);
      solver.solve(yMat, results);
      solved = true;
    }
    return solved;
  }

  /**
   * Residual sum of squares of each dependent variable.  May only be called
   * after a successful call to getSolution(), and must be given the
   * (unmodified) results of that call and an array of the correct size.
   */
  public void getResidualSumOfSquares(DenseMatrix64F results, double[] residuals) {
    Preconditions.checkState(solved, "getSolution() has not succeeded");
    Preconditions.checkArgument(residuals.length == numY
        && results.getNumRows() == numX
        && results.getNumCols() == numY);
    for (int i = 0; i < numY; ++i) {
      double sumSq = y2Sums[i];
      for (int j = 0; j < numX; ++j) {
        sumSq -= results.unsafe_get(j, i) * yMat.unsafe_get(j, i);
      }
      // due to roundoff, sumSq could end up slightly negative
      residuals[i] = Math.max(0, sumSq);
    }
  }

  /** Sum of y^2 over every observation of dependent variable k. */
  public double getTotalSumOfSquares(int k) {
    return y2Sums[k];
  }

  public int getNumInputs() {
    return numInputs;
  }

  /**
   * Reset the solver to its no-inputs state.
   */
  public void reset() {
    numInputs = 0;
    Arrays.fill(xSums, 0);
    Arrays.fill(ySums, 0);
    Arrays.fill(y2Sums, 0);
    solved = false;
  }
}
