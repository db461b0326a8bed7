package org.mitoseeker.exceptions;

/**
 * <p/>
 * Class MitoSeekerException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class MitoSeekerException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public MitoSeekerException( String msg ) {
        super(msg);
    }

    public MitoSeekerException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of MitoSeekerException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends MitoSeekerException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
    }
}
