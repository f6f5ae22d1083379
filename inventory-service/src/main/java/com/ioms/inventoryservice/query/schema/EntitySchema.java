package com.ioms.inventoryservice.query.schema;

import com.ioms.inventoryservice.model.Brand;
import com.ioms.inventoryservice.model.Category;
import com.ioms.inventoryservice.model.Customer;
import com.ioms.inventoryservice.model.Order;
import com.ioms.inventoryservice.model.OrderItem;
import com.ioms.inventoryservice.model.OrderStatus;
import com.ioms.inventoryservice.model.Payment;
import com.ioms.inventoryservice.model.PaymentMethod;
import com.ioms.inventoryservice.model.PaymentStatus;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.model.Stock;
import com.ioms.inventoryservice.model.Warehouse;
import com.ioms.inventoryservice.query.InvalidPathException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.ioms.inventoryservice.query.schema.Cardinality.MANY;
import static com.ioms.inventoryservice.query.schema.Cardinality.ONE;

/**
 * Static description of the nine entities: which attributes can be projected, filtered and
 * ordered on, and which named relations connect them.
 */
@Component
public class EntitySchema {

    private final Map<EntityKind, EntityDescriptor> descriptors = new EnumMap<>(EntityKind.class);

    public EntitySchema() {
        register(EntityDescriptor.builder(EntityKind.BRAND)
                .attribute("name", String.class, Brand::getName)
                .attribute("isActive", Boolean.class, Brand::getIsActive)
                .attribute("createdAt", Instant.class, Brand::getCreatedAt)
                .reverse("products", EntityKind.PRODUCT, MANY, "brand", Product::getBrand)
                .defaultOrdering("name"));

        register(EntityDescriptor.builder(EntityKind.CATEGORY)
                .attribute("name", String.class, Category::getName)
                .attribute("isActive", Boolean.class, Category::getIsActive)
                .attribute("createdAt", Instant.class, Category::getCreatedAt)
                .reverse("products", EntityKind.PRODUCT, MANY, "category", Product::getCategory)
                .defaultOrdering("name"));

        register(EntityDescriptor.builder(EntityKind.PRODUCT)
                .attribute("name", String.class, Product::getName)
                .attribute("sku", String.class, Product::getSku)
                .attribute("price", BigDecimal.class, Product::getPrice)
                .attribute("isActive", Boolean.class, Product::getIsActive)
                .attribute("createdAt", Instant.class, Product::getCreatedAt)
                .foreignKey("brand", Product::getBrand)
                .foreignKey("category", Product::getCategory)
                .forward("brand", EntityKind.BRAND, Product::getBrand)
                .forward("category", EntityKind.CATEGORY, Product::getCategory)
                .reverse("stocks", EntityKind.STOCK, MANY, "product", Stock::getProduct)
                .reverse("orderItems", EntityKind.ORDER_ITEM, MANY, "product", OrderItem::getProduct)
                .defaultOrdering("name"));

        register(EntityDescriptor.builder(EntityKind.WAREHOUSE)
                .attribute("name", String.class, Warehouse::getName)
                .attribute("city", String.class, Warehouse::getCity)
                .attribute("createdAt", Instant.class, Warehouse::getCreatedAt)
                .reverse("stocks", EntityKind.STOCK, MANY, "warehouse", Stock::getWarehouse)
                .defaultOrdering("city,name"));

        register(EntityDescriptor.builder(EntityKind.STOCK)
                .attribute("qty", Integer.class, Stock::getQty)
                .attribute("reserved", Integer.class, Stock::getReserved)
                .computed("availableQty", Integer.class, Stock::getAvailableQty)
                .attribute("createdAt", Instant.class, Stock::getCreatedAt)
                .attribute("updatedAt", Instant.class, Stock::getUpdatedAt)
                .foreignKey("product", Stock::getProduct)
                .foreignKey("warehouse", Stock::getWarehouse)
                .forward("product", EntityKind.PRODUCT, Stock::getProduct)
                .forward("warehouse", EntityKind.WAREHOUSE, Stock::getWarehouse));

        register(EntityDescriptor.builder(EntityKind.CUSTOMER)
                .attribute("fullName", String.class, Customer::getFullName)
                .attribute("email", String.class, Customer::getEmail)
                .attribute("createdAt", Instant.class, Customer::getCreatedAt)
                .reverse("orders", EntityKind.ORDER, MANY, "customer", Order::getCustomer)
                .defaultOrdering("fullName"));

        register(EntityDescriptor.builder(EntityKind.ORDER)
                .attribute("status", OrderStatus.class, Order::getStatus)
                .attribute("createdAt", Instant.class, Order::getCreatedAt)
                .foreignKey("customer", Order::getCustomer)
                .forward("customer", EntityKind.CUSTOMER, Order::getCustomer)
                .reverse("items", EntityKind.ORDER_ITEM, MANY, "order", OrderItem::getOrder)
                .reverse("payment", EntityKind.PAYMENT, ONE, "order", Payment::getOrder)
                .defaultOrdering("-createdAt"));

        register(EntityDescriptor.builder(EntityKind.ORDER_ITEM)
                .attribute("qty", Integer.class, OrderItem::getQty)
                .attribute("unitPrice", BigDecimal.class, OrderItem::getUnitPrice)
                .computed("totalPrice", BigDecimal.class, OrderItem::getTotalPrice)
                .attribute("createdAt", Instant.class, OrderItem::getCreatedAt)
                .foreignKey("order", OrderItem::getOrder)
                .foreignKey("product", OrderItem::getProduct)
                .forward("order", EntityKind.ORDER, OrderItem::getOrder)
                .forward("product", EntityKind.PRODUCT, OrderItem::getProduct));

        register(EntityDescriptor.builder(EntityKind.PAYMENT)
                .attribute("method", PaymentMethod.class, Payment::getMethod)
                .attribute("amount", BigDecimal.class, Payment::getAmount)
                .attribute("status", PaymentStatus.class, Payment::getStatus)
                .attribute("createdAt", Instant.class, Payment::getCreatedAt)
                .foreignKey("order", Payment::getOrder)
                .forward("order", EntityKind.ORDER, Payment::getOrder)
                .defaultOrdering("-createdAt"));
    }

    public EntityDescriptor describe(EntityKind kind) {
        return descriptors.get(kind);
    }

    /**
     * Walks {@code rawPath} (tokens separated by {@code .} or {@code __}) from {@code source}.
     * Returns empty if any token is not a relation of the entity reached so far.
     */
    public Optional<RelationPath> findPath(EntityKind source, String rawPath) {
        List<String> tokens = SchemaNames.splitPath(rawPath);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        RelationPath path = RelationPath.empty(source);
        for (String token : tokens) {
            Optional<RelationDescriptor> hop = describe(path.target()).findRelation(token);
            if (hop.isEmpty()) {
                return Optional.empty();
            }
            path = path.append(hop.get());
        }
        return Optional.of(path);
    }

    public RelationPath parsePath(EntityKind source, String rawPath) {
        return findPath(source, rawPath).orElseThrow(() -> new InvalidPathException(
                String.format("Invalid relation path '%s' on %s", rawPath, source.entityName())));
    }

    private void register(EntityDescriptor.Builder builder) {
        EntityDescriptor descriptor = builder.build();
        descriptors.put(descriptor.getKind(), descriptor);
    }
}
