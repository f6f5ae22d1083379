package com.ioms.inventoryservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "inventory")
public class InventoryProperties {

    private RelatedQuery relatedQuery = new RelatedQuery();
    private Stock stock = new Stock();

    @Data
    public static class RelatedQuery {
        // Adds the plan description to every /related response
        private boolean includeQueryDiagnostic = true;
    }

    @Data
    public static class Stock {
        private int lowStockThreshold = 10;
    }
}
