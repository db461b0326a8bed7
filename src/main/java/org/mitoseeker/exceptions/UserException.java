package org.mitoseeker.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files,
 * variant records that cannot be placed on the mitochondrial reference, or an inconsistent annotation setup.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(final Path file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(final Path path, final Exception e) {
            this(path, getMessage(e), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final Path file, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.toAbsolutePath().toUri(), message, getMessage(e)), e);
        }
    }

    /**
     * <p/>
     * Class UserException.BadConfiguration
     * <p/>
     * The annotation table or reference sequence needed to locate variants is missing or malformed.
     * Nothing can be located correctly without them, so this always aborts the whole run.
     */
    public static class BadConfiguration extends UserException {
        private static final long serialVersionUID = 0L;

        public BadConfiguration(final String message) {
            super(message);
        }

        public BadConfiguration(final String message, final Throwable cause) {
            super(message, cause);
        }

        public BadConfiguration(final String source, final long lineNumber, final String message) {
            super(String.format("Malformed annotation table %s at line %d: %s", source, lineNumber, message));
        }
    }

    /**
     * <p/>
     * Class UserException.MalformedVariant
     * <p/>
     * A single variant record cannot be interpreted.  Only the offending record is skipped.
     */
    public static class MalformedVariant extends UserException {
        private static final long serialVersionUID = 0L;

        private final String record;

        public MalformedVariant(final String record, final String message) {
            super(String.format("Malformed variant %s: %s", record, message));
            this.record = record;
        }

        /**
         * @return a textual rendering of the record that could not be interpreted.
         */
        public String getRecord() {
            return record;
        }
    }

    /**
     * <p/>
     * Class UserException.UnsupportedReference
     * <p/>
     * A variant lies on a contig, or at a position, that the mitochondrial reference does not cover.
     * Fatal for the variant set containing the record.
     */
    public static class UnsupportedReference extends UserException {
        private static final long serialVersionUID = 0L;

        public UnsupportedReference(final String message) {
            super(message);
        }
    }
}
