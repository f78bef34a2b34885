package nl.bytesoflife.deltascad.model;

/**
 * Thrown when a builder is finalized before a required parameter was set.
 */
public class MissingParameterException extends ScadException {

    private final String statementType;
    private final String fieldName;

    public MissingParameterException(String statementType, String fieldName) {
        super("Required parameter '" + fieldName + "' of " + statementType + " is not set");
        this.statementType = statementType;
        this.fieldName = fieldName;
    }

    public String getStatementType() {
        return statementType;
    }

    public String getFieldName() {
        return fieldName;
    }
}
