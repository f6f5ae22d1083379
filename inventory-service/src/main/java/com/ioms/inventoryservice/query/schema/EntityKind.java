package com.ioms.inventoryservice.query.schema;

import com.ioms.inventoryservice.model.BaseEntity;
import com.ioms.inventoryservice.model.Brand;
import com.ioms.inventoryservice.model.Category;
import com.ioms.inventoryservice.model.Customer;
import com.ioms.inventoryservice.model.Order;
import com.ioms.inventoryservice.model.OrderItem;
import com.ioms.inventoryservice.model.Payment;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.model.Stock;
import com.ioms.inventoryservice.model.Warehouse;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of entities the related-query engine knows about.
 */
@Getter
@RequiredArgsConstructor
public enum EntityKind {
    BRAND(Brand.class),
    CATEGORY(Category.class),
    PRODUCT(Product.class),
    WAREHOUSE(Warehouse.class),
    STOCK(Stock.class),
    CUSTOMER(Customer.class),
    ORDER(Order.class),
    ORDER_ITEM(OrderItem.class),
    PAYMENT(Payment.class);

    private final Class<? extends BaseEntity> entityClass;

    /**
     * Lower-case name used in query parameters, e.g. {@code orderitem}.
     */
    public String entityName() {
        return normalize(name());
    }

    /**
     * Looks up a kind by its parameter name. Case and underscores are ignored,
     * so {@code orderitem}, {@code order_item} and {@code OrderItem} are the same kind.
     */
    public static Optional<EntityKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(name.trim());
        return Arrays.stream(values())
                .filter(kind -> kind.entityName().equals(normalized))
                .findFirst();
    }

    private static String normalize(String name) {
        return name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
