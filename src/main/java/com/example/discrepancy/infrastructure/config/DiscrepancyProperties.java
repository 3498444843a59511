package com.example.discrepancy.infrastructure.config;

import com.example.discrepancy.domain.model.ReportColumns;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized report processing configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "discrepancy")
public class DiscrepancyProperties {

    private final Columns columns = new Columns();
    private final Storage storage = new Storage();
    private final Executor executor = new Executor();

    /**
     * Unit-of-measure tokens stripped from quantity cells, removed in list order.
     */
    private List<String> unitTokens = new ArrayList<>(List.of(
            "М3", "КГ", "Т", "шт", "кг", "т", "м3",
            "M3", "KG", "T", "pcs", "kg", "t", "m3"));

    public Columns getColumns() {
        return columns;
    }

    public Storage getStorage() {
        return storage;
    }

    public Executor getExecutor() {
        return executor;
    }

    public List<String> getUnitTokens() {
        return unitTokens;
    }

    public void setUnitTokens(List<String> unitTokens) {
        this.unitTokens = unitTokens;
    }

    public static class Columns {

        private String materialId = "ID Материала";
        private String requestedQuantity = "Кол-во по заявке";
        private String receivedQuantity = "Поступило всего";
        private String discrepancy = "Расхождение заявка-приход";

        public String getMaterialId() {
            return materialId;
        }

        public void setMaterialId(String materialId) {
            this.materialId = materialId;
        }

        public String getRequestedQuantity() {
            return requestedQuantity;
        }

        public void setRequestedQuantity(String requestedQuantity) {
            this.requestedQuantity = requestedQuantity;
        }

        public String getReceivedQuantity() {
            return receivedQuantity;
        }

        public void setReceivedQuantity(String receivedQuantity) {
            this.receivedQuantity = receivedQuantity;
        }

        public String getDiscrepancy() {
            return discrepancy;
        }

        public void setDiscrepancy(String discrepancy) {
            this.discrepancy = discrepancy;
        }

        public ReportColumns toReportColumns() {
            return new ReportColumns(materialId, requestedQuantity, receivedQuantity, discrepancy);
        }
    }

    public static class Storage {

        private String directory = "temp";
        private Duration retention = Duration.ofHours(1);

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class Executor {

        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
