package io.rowfilter.kernel;

/**
 * Logical type of a column.
 */
public enum ColumnType {
    BOOL("boolean"),
    INT("int"),
    REAL("double"),
    STR("String");

    private final String javaType;

    ColumnType(String javaType) {
        this.javaType = javaType;
    }

    /**
     * Java element type used for this column in generated source.
     */
    public String javaType() {
        return javaType;
    }

    public boolean isNumeric() {
        return this == INT || this == REAL;
    }
}
