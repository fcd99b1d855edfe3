package com.stg2va.core.error;

/**
 * Structural or referential defect in the STG text.
 *
 * <p>Carries the 1-based line number and the offending identifier so the user can find the
 * defect in the source file.
 */
public class MalformedGraphException extends StgCompilationException {

    private final int lineNumber;
    private final String identifier;

    public MalformedGraphException(int lineNumber, String identifier, String message) {
        super(format(lineNumber, identifier, message));
        this.lineNumber = lineNumber;
        this.identifier = identifier;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getIdentifier() {
        return identifier;
    }

    private static String format(int lineNumber, String identifier, String message) {
        StringBuilder sb = new StringBuilder();
        if (lineNumber > 0) {
            sb.append("line ").append(lineNumber).append(": ");
        }
        sb.append(message);
        if (identifier != null) {
            sb.append(" [").append(identifier).append("]");
        }
        return sb.toString();
    }
}
