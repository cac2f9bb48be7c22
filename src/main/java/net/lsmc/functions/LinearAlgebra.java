package net.lsmc.functions;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * This class implements some methods from linear algebra (solution of a linear equation in the
 * least square sense, rank determination).
 *
 * It is a functional wrapper around Apache commons math.
 */
public class LinearAlgebra {

	private LinearAlgebra() {
	}

	/**
	 * Find the solution of the linear equation A x = b in the least square sense, requiring that A has
	 * full column rank, i.e., that the solution is unique.
	 *
	 * @param matrix The matrix A given as double[n][m] with n &ge; m.
	 * @param vector The vector b given as double[n].
	 * @return The least square solution x given as double[m].
	 * @throws SingularMatrixException Thrown if the (numerical) rank of A is less than m.
	 */
	public static double[] solveLinearEquationLeastSquareFullRank(double[][] matrix, double[] vector) {
		SingularValueDecomposition singularValueDecomposition = new SingularValueDecomposition(new Array2DRowRealMatrix(matrix, false));

		int numberOfColumns = matrix[0].length;
		if(matrix.length < numberOfColumns || singularValueDecomposition.getRank() < numberOfColumns) {
			throw new SingularMatrixException();
		}

		return singularValueDecomposition.getSolver().solve(new ArrayRealVector(vector)).toArray();
	}

	/**
	 * Returns the numerical rank of a matrix, determined from its singular values.
	 *
	 * @param matrix A matrix given as double[n][m].
	 * @return The rank of the matrix.
	 */
	public static int getRank(double[][] matrix) {
		return new SingularValueDecomposition(new Array2DRowRealMatrix(matrix, false)).getRank();
	}
}
