package org.mitoseeker.utils.param;

/**
 * Range checks for numeric arguments, throwing {@link IllegalArgumentException} on violation.
 */
public final class ParamUtils {

    private ParamUtils () {}

    /**
     * Checks that the input is within range and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param min minimum value for val (inclusive)
     * @param max maximum value for val (inclusive)
     * @param message the text message that would be pass to the exception thrown when val gt min or val lt max.
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static int inRange(final int val, final int min, final int max, final String message) {
        if ((val >= min) && (val <= max)){
            return val;
        } else {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Checks that the input is greater than or equal to 0
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown when val &lt; 0.
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static int isPositiveOrZero(final int val, final String message) {
        if (val < 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * Checks that the input is greater than 0
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown when val &le; 0.
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static int isPositive(final int val, final String message) {
        if (val <= 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }
}
