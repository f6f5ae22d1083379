package com.ioms.inventoryservice.query.filter;

import com.ioms.inventoryservice.query.schema.AttributeDescriptor;
import com.ioms.inventoryservice.query.schema.RelationPath;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * One compiled {@code field[__lookup]=value} condition, anchored at the root entity.
 */
@Getter
@RequiredArgsConstructor
public class FilterClause {

    private final RelationPath path;
    private final AttributeDescriptor attribute;
    private final Lookup lookup;
    private final Object value;

    public String describe() {
        String prefix = path.isEmpty() ? "" : path.dotted() + ".";
        return prefix + attribute.getName() + " " + lookup.token() + " " + value;
    }

    @Override
    public String toString() {
        return describe();
    }
}
