package com.ioms.inventoryservice.query;

import org.hibernate.boot.model.FunctionContributions;
import org.hibernate.boot.model.FunctionContributor;
import org.hibernate.type.BasicType;
import org.hibernate.type.StandardBasicTypes;

/**
 * SQL functions used by the related-query engine, registered with Hibernate through
 * {@code META-INF/services/org.hibernate.boot.model.FunctionContributor}.
 */
public class QueryFunctionContributor implements FunctionContributor {

    /**
     * {@code id_in_array(column, :ids)}: true when the column value is an element of the array parameter.
     * The whole id set travels as one bind parameter, however many ids it holds.
     */
    public static final String ID_IN_ARRAY = "id_in_array";

    @Override
    public void contributeFunctions(FunctionContributions functionContributions) {
        BasicType<Boolean> booleanType = functionContributions.getTypeConfiguration()
                .getBasicTypeRegistry()
                .resolve(StandardBasicTypes.BOOLEAN);
        functionContributions.getFunctionRegistry()
                .registerPattern(ID_IN_ARRAY, "(?1 = any(?2))", booleanType);
    }
}
