package com.payshield.gleaner.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "app")
@Validated
public class AppProperties {
    private Data data = new Data();
    private Output output = new Output();
    private Detection detection = new Detection();
    private Batch batch = new Batch();

    public Data getData() { return data; }
    public Output getOutput() { return output; }
    public Detection getDetection() { return detection; }
    public Batch getBatch() { return batch; }

    public static class Data {
        private String invoicesPath = "data/invoice.csv";
        private String lineItemsPath = "data/line_item.csv";
        public String getInvoicesPath() { return invoicesPath; }
        public void setInvoicesPath(String invoicesPath) { this.invoicesPath = invoicesPath; }
        public String getLineItemsPath() { return lineItemsPath; }
        public void setLineItemsPath(String lineItemsPath) { this.lineItemsPath = lineItemsPath; }
    }

    public static class Output {
        // blank disables the CSV export
        private String gleansPath = "";
        public String getGleansPath() { return gleansPath; }
        public void setGleansPath(String gleansPath) { this.gleansPath = gleansPath; }
    }

    public static class Detection {
        @Min(1)
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private String zone = "UTC";
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }
    }

    public static class Batch {
        private boolean runOnStartup = false;
        public boolean isRunOnStartup() { return runOnStartup; }
        public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }
    }
}
