package net.lsmc.functions;

public class MatrixUtils {

    private MatrixUtils() {
    }

    /**
     * Creates the matrix of monomials <code>x[i]^k</code>, <code>k = 0, ..., numberOfColumns-1</code>
     * (a Vandermonde matrix with ascending powers).
     *
     * @param values The values x.
     * @param numberOfColumns The number of monomials.
     * @return The matrix given as double[values.length][numberOfColumns].
     */
    public static double[][] createVandermondeMatrix(double[] values, int numberOfColumns) {
        double[][] matrix = new double[values.length][numberOfColumns];
        for(int row = 0; row < values.length; row++) {
            double power = 1.0;
            for(int column = 0; column < numberOfColumns; column++) {
                matrix[row][column] = power;
                power *= values[row];
            }
        }
        return matrix;
    }

    public static String printMatrix(double[][] matrix) {
        StringBuilder stringBuilder = new StringBuilder();
        for (double[] row : matrix) {
            for (double value : row) {
                stringBuilder.append(value).append("\t");
            }
            stringBuilder.append("\n");
        }
        return stringBuilder.toString();
    }
}
