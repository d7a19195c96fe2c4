package com.kmg.grobid.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Defaults for a client run, bound from {@code application.yml}. A {@code config.json}
 * file can override the server block at startup; see {@link ConfigFileLoader}.
 */
@Validated
@ConfigurationProperties(prefix = "grobid")
public class GrobidProperties {
    @NotBlank
    private String server = "localhost";
    @Min(1)
    private Integer port = 8070;
    @Min(1)
    private int batchSize = 1000;
    @Min(1)
    private int numberOfProcesses = 10;
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration sleepTime = Duration.ofSeconds(5);
    private List<String> coordinates = new ArrayList<>(List.of("persName", "figure", "ref", "biblStruct", "formula"));
    @NotNull
    private Http http = new Http();
    @NotNull
    private Retry retry = new Retry();
    @NotNull
    private Input input = new Input();
    @NotNull
    private Output output = new Output();
    @NotNull
    private Cli cli = new Cli();

    public String getServer() {
        return server;
    }

    public void setServer(String server) {
        this.server = server;
    }

    public Integer getPort() {
        return port;
    }

    public void setPort(Integer port) {
        this.port = port;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getNumberOfProcesses() {
        return numberOfProcesses;
    }

    public void setNumberOfProcesses(int numberOfProcesses) {
        this.numberOfProcesses = numberOfProcesses;
    }

    public Duration getSleepTime() {
        return sleepTime;
    }

    public void setSleepTime(Duration sleepTime) {
        this.sleepTime = sleepTime;
    }

    public List<String> getCoordinates() {
        return coordinates;
    }

    public void setCoordinates(List<String> coordinates) {
        this.coordinates = coordinates;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Input getInput() {
        return input;
    }

    public void setInput(Input input) {
        this.input = input;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Http {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofMinutes(5);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    /**
     * Handling of 503 responses. The defaults retry forever with a fixed delay.
     */
    public static class Retry {
        /** Total attempts per file; 0 means unbounded. */
        @Min(0)
        private int maxAttempts = 0;
        @DecimalMin("1.0")
        private double backoffMultiplier = 1.0;
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration maxSleepTime = Duration.ofMinutes(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxSleepTime() {
            return maxSleepTime;
        }

        public void setMaxSleepTime(Duration maxSleepTime) {
            this.maxSleepTime = maxSleepTime;
        }
    }

    public static class Input {
        @NotBlank
        private String extension = ".pdf";

        public String getExtension() {
            return extension;
        }

        public void setExtension(String extension) {
            this.extension = extension;
        }
    }

    public static class Output {
        @NotBlank
        private String suffix = ".tei.xml";
        private boolean preserveTree = false;

        public String getSuffix() {
            return suffix;
        }

        public void setSuffix(String suffix) {
            this.suffix = suffix;
        }

        public boolean isPreserveTree() {
            return preserveTree;
        }

        public void setPreserveTree(boolean preserveTree) {
            this.preserveTree = preserveTree;
        }
    }

    public static class Cli {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
