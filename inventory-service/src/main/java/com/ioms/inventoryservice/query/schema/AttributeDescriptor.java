package com.ioms.inventoryservice.query.schema;

import com.ioms.inventoryservice.model.BaseEntity;
import lombok.Getter;

import java.util.List;
import java.util.function.Function;

/**
 * A scalar attribute exposed by the related-query engine.
 * Attributes with an empty {@link #getJpaPath() JPA path} are computed in Java and can be
 * projected but not filtered or ordered on.
 */
@Getter
public final class AttributeDescriptor {

    private final String name;
    private final Class<?> javaType;
    private final List<String> jpaPath;
    private final Function<BaseEntity, Object> reader;

    AttributeDescriptor(String name, Class<?> javaType, List<String> jpaPath, Function<BaseEntity, Object> reader) {
        this.name = name;
        this.javaType = javaType;
        this.jpaPath = List.copyOf(jpaPath);
        this.reader = reader;
    }

    public boolean isQueryable() {
        return !jpaPath.isEmpty();
    }

    public Object read(BaseEntity entity) {
        return reader.apply(entity);
    }

    @Override
    public String toString() {
        return name;
    }
}
