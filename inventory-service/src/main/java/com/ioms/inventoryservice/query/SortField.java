package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.query.schema.AttributeDescriptor;
import com.ioms.inventoryservice.query.schema.RelationPath;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public class SortField {

    private final RelationPath path;
    private final AttributeDescriptor attribute;
    private final boolean descending;

    @Override
    public String toString() {
        String field = path.isEmpty() ? attribute.getName() : path.dotted() + "." + attribute.getName();
        return descending ? "-" + field : field;
    }
}
