package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.query.schema.EntitySchema;
import com.ioms.inventoryservice.query.schema.RelationPath;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.ioms.inventoryservice.query.schema.EntityKind.BRAND;
import static com.ioms.inventoryservice.query.schema.EntityKind.CATEGORY;
import static com.ioms.inventoryservice.query.schema.EntityKind.CUSTOMER;
import static com.ioms.inventoryservice.query.schema.EntityKind.ORDER;
import static com.ioms.inventoryservice.query.schema.EntityKind.ORDER_ITEM;
import static com.ioms.inventoryservice.query.schema.EntityKind.PAYMENT;
import static com.ioms.inventoryservice.query.schema.EntityKind.PRODUCT;
import static com.ioms.inventoryservice.query.schema.EntityKind.STOCK;
import static com.ioms.inventoryservice.query.schema.EntityKind.WAREHOUSE;

/**
 * Maps a (source entity, target entity name) pair to the relation path that reaches the target.
 * <p>
 * Every ordered pair of distinct kinds has an entry. A name that is not an entity kind is tried as a
 * raw relation path ({@code stocks}, {@code items__product}) before giving up.
 */
@Component
public class RelationPathResolver {

    private static final Map<EntityKind, Map<EntityKind, String>> ROUTES = new EnumMap<>(EntityKind.class);

    static {
        ROUTES.put(BRAND, Map.of(
                CATEGORY, "products.category",
                PRODUCT, "products",
                WAREHOUSE, "products.stocks.warehouse",
                STOCK, "products.stocks",
                CUSTOMER, "products.orderItems.order.customer",
                ORDER, "products.orderItems.order",
                ORDER_ITEM, "products.orderItems",
                PAYMENT, "products.orderItems.order.payment"));
        ROUTES.put(CATEGORY, Map.of(
                BRAND, "products.brand",
                PRODUCT, "products",
                WAREHOUSE, "products.stocks.warehouse",
                STOCK, "products.stocks",
                CUSTOMER, "products.orderItems.order.customer",
                ORDER, "products.orderItems.order",
                ORDER_ITEM, "products.orderItems",
                PAYMENT, "products.orderItems.order.payment"));
        ROUTES.put(PRODUCT, Map.of(
                BRAND, "brand",
                CATEGORY, "category",
                WAREHOUSE, "stocks.warehouse",
                STOCK, "stocks",
                CUSTOMER, "orderItems.order.customer",
                ORDER, "orderItems.order",
                ORDER_ITEM, "orderItems",
                PAYMENT, "orderItems.order.payment"));
        ROUTES.put(WAREHOUSE, Map.of(
                PRODUCT, "stocks.product",
                STOCK, "stocks",
                BRAND, "stocks.product.brand",
                CATEGORY, "stocks.product.category",
                ORDER_ITEM, "stocks.product.orderItems",
                ORDER, "stocks.product.orderItems.order",
                CUSTOMER, "stocks.product.orderItems.order.customer",
                PAYMENT, "stocks.product.orderItems.order.payment"));
        ROUTES.put(STOCK, Map.of(
                PRODUCT, "product",
                WAREHOUSE, "warehouse",
                BRAND, "product.brand",
                CATEGORY, "product.category",
                ORDER_ITEM, "product.orderItems",
                ORDER, "product.orderItems.order",
                CUSTOMER, "product.orderItems.order.customer",
                PAYMENT, "product.orderItems.order.payment"));
        ROUTES.put(CUSTOMER, Map.of(
                ORDER, "orders",
                ORDER_ITEM, "orders.items",
                PRODUCT, "orders.items.product",
                BRAND, "orders.items.product.brand",
                CATEGORY, "orders.items.product.category",
                STOCK, "orders.items.product.stocks",
                WAREHOUSE, "orders.items.product.stocks.warehouse",
                PAYMENT, "orders.payment"));
        ROUTES.put(ORDER, Map.of(
                CUSTOMER, "customer",
                ORDER_ITEM, "items",
                PAYMENT, "payment",
                PRODUCT, "items.product",
                BRAND, "items.product.brand",
                CATEGORY, "items.product.category",
                STOCK, "items.product.stocks",
                WAREHOUSE, "items.product.stocks.warehouse"));
        ROUTES.put(ORDER_ITEM, Map.of(
                ORDER, "order",
                PRODUCT, "product",
                CUSTOMER, "order.customer",
                PAYMENT, "order.payment",
                BRAND, "product.brand",
                CATEGORY, "product.category",
                STOCK, "product.stocks",
                WAREHOUSE, "product.stocks.warehouse"));
        ROUTES.put(PAYMENT, Map.of(
                ORDER, "order",
                CUSTOMER, "order.customer",
                ORDER_ITEM, "order.items",
                PRODUCT, "order.items.product",
                BRAND, "order.items.product.brand",
                CATEGORY, "order.items.product.category",
                STOCK, "order.items.product.stocks",
                WAREHOUSE, "order.items.product.stocks.warehouse"));
    }

    private final EntitySchema schema;
    private final Map<EntityKind, Map<EntityKind, RelationPath>> table = new EnumMap<>(EntityKind.class);

    public RelationPathResolver(EntitySchema schema) {
        this.schema = schema;
        for (EntityKind source : EntityKind.values()) {
            Map<EntityKind, RelationPath> paths = new EnumMap<>(EntityKind.class);
            paths.put(source, RelationPath.empty(source));
            for (EntityKind target : EntityKind.values()) {
                if (target == source) {
                    continue;
                }
                String route = ROUTES.getOrDefault(source, Map.of()).get(target);
                if (route == null) {
                    throw new IllegalStateException("No relation route from " + source + " to " + target);
                }
                RelationPath path = schema.findPath(source, route).orElseThrow(() ->
                        new IllegalStateException("Route '" + route + "' is not valid on " + source));
                if (path.target() != target) {
                    throw new IllegalStateException("Route '" + route + "' from " + source + " reaches "
                            + path.target() + ", expected " + target);
                }
                paths.put(target, path);
            }
            table.put(source, paths);
        }
    }

    /**
     * @throws InvalidPathException if {@code name} is neither an entity name nor a relation path on {@code source}
     */
    public RelationPath resolve(EntityKind source, String name) {
        return find(source, name).orElseThrow(() -> new InvalidPathException(
                String.format("Cannot resolve '%s' from %s", name, source.entityName())));
    }

    public Optional<RelationPath> find(EntityKind source, String name) {
        Optional<EntityKind> target = EntityKind.fromName(name);
        if (target.isPresent()) {
            return Optional.of(table.get(source).get(target.get()));
        }
        return schema.findPath(source, name);
    }
}
