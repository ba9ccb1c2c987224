package org.piecestore.config;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.protocol.ProtocolConstants;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Storage node configuration options.
 * 
 * Can be read from a properties file, for example:
 * <pre>
 * storage.dir=/var/lib/piecestore
 * server.port=28967
 * retain.status=ENABLED
 * retain.time-skew=PT72H
 * trusted.satellites=MCOWBQYDK2VWAAIAAA...,MCOWBQYDK2VWAAIBBB...
 * </pre>
 */
public class StorageNodeConfig {
    
    private Path storageDir = Paths.get("storage");
    private int port = ProtocolConstants.STORAGE_NODE_DEFAULT_PORT;
    private int workerThreads = 32;
    private int streamTimeout = 30000;
    private Duration orderLimitGracePeriod = Duration.ofHours(1);
    private int maxDownloadChunkSize = 256 * 1024;
    private RetainStatus retainStatus = RetainStatus.ENABLED;
    private Duration retainTimeSkew = Duration.ofHours(72);
    private Duration trashExpiration = Duration.ofDays(7);
    private Duration maintenanceInterval = Duration.ofHours(1);
    private List<String> trustedSatellites = new ArrayList<>();
    
    public StorageNodeConfig() {
    }
    
    /**
     * Loads a configuration from a properties file.
     */
    public static StorageNodeConfig load(Path file) throws InvalidArgumentException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            throw new InvalidArgumentException("cannot read config " + file + ": " + e.getMessage());
        }
        StorageNodeConfig config = new StorageNodeConfig();
        config.apply(props);
        return config;
    }
    
    /**
     * Applies {@code --key=value} command line overrides.
     */
    public void applyArgs(String[] args) throws InvalidArgumentException {
        Properties props = new Properties();
        if (args != null) {
            for (String arg : args) {
                if (arg != null && arg.startsWith("--") && arg.contains("=")) {
                    String[] parts = arg.substring(2).split("=", 2);
                    props.setProperty(parts[0].trim(), parts[1].trim());
                }
            }
        }
        apply(props);
    }
    
    /**
     * Applies every known key present in the properties.
     */
    public void apply(Properties props) throws InvalidArgumentException {
        try {
            if (props.containsKey("storage.dir")) {
                storageDir = Paths.get(props.getProperty("storage.dir"));
            }
            if (props.containsKey("server.port")) {
                port = Integer.parseInt(props.getProperty("server.port"));
            }
            if (props.containsKey("server.worker-threads")) {
                workerThreads = Integer.parseInt(props.getProperty("server.worker-threads"));
            }
            if (props.containsKey("server.stream-timeout")) {
                streamTimeout = Integer.parseInt(props.getProperty("server.stream-timeout"));
            }
            if (props.containsKey("orders.grace-period")) {
                orderLimitGracePeriod = Duration.parse(props.getProperty("orders.grace-period"));
            }
            if (props.containsKey("download.max-chunk-size")) {
                maxDownloadChunkSize = Integer.parseInt(props.getProperty("download.max-chunk-size"));
            }
            if (props.containsKey("retain.status")) {
                retainStatus = RetainStatus.valueOf(props.getProperty("retain.status").trim().toUpperCase());
            }
            if (props.containsKey("retain.time-skew")) {
                retainTimeSkew = Duration.parse(props.getProperty("retain.time-skew"));
            }
            if (props.containsKey("trash.expiration")) {
                trashExpiration = Duration.parse(props.getProperty("trash.expiration"));
            }
            if (props.containsKey("maintenance.interval")) {
                maintenanceInterval = Duration.parse(props.getProperty("maintenance.interval"));
            }
            if (props.containsKey("trusted.satellites")) {
                trustedSatellites = new ArrayList<>();
                for (String key : Arrays.asList(props.getProperty("trusted.satellites").split(","))) {
                    if (!key.trim().isEmpty()) {
                        trustedSatellites.add(key.trim());
                    }
                }
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new InvalidArgumentException("bad config value: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("bad retain.status: " + e.getMessage());
        }
    }
    
    public Path getStorageDir() {
        return storageDir;
    }
    
    /**
     * Sets the directory holding pieces, trash and the node identity.
     * Default: ./storage
     */
    public void setStorageDir(Path storageDir) {
        this.storageDir = storageDir;
    }
    
    public int getPort() {
        return port;
    }
    
    /**
     * Sets the listen port. 0 picks a free port.
     * Default: 28967
     */
    public void setPort(int port) {
        this.port = port;
    }
    
    public int getWorkerThreads() {
        return workerThreads;
    }
    
    /**
     * Sets the number of connections served concurrently.
     * Default: 32
     */
    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }
    
    public int getStreamTimeout() {
        return streamTimeout;
    }
    
    /**
     * Sets how long a session may wait for the next message in milliseconds.
     * Default: 30000ms
     */
    public void setStreamTimeout(int streamTimeout) {
        this.streamTimeout = streamTimeout;
    }
    
    public Duration getOrderLimitGracePeriod() {
        return orderLimitGracePeriod;
    }
    
    /**
     * Sets how long after creation an order limit is still accepted.
     * Default: 1 hour
     */
    public void setOrderLimitGracePeriod(Duration orderLimitGracePeriod) {
        this.orderLimitGracePeriod = orderLimitGracePeriod;
    }
    
    public int getMaxDownloadChunkSize() {
        return maxDownloadChunkSize;
    }
    
    /**
     * Sets the largest chunk sent in one download response.
     * Default: 256 KiB
     */
    public void setMaxDownloadChunkSize(int maxDownloadChunkSize) {
        this.maxDownloadChunkSize = maxDownloadChunkSize;
    }
    
    public RetainStatus getRetainStatus() {
        return retainStatus;
    }
    
    public void setRetainStatus(RetainStatus retainStatus) {
        this.retainStatus = retainStatus;
    }
    
    public Duration getRetainTimeSkew() {
        return retainTimeSkew;
    }
    
    /**
     * Sets how far the retain threshold is moved back to absorb clock skew
     * between satellite and storage node.
     * Default: 72 hours
     */
    public void setRetainTimeSkew(Duration retainTimeSkew) {
        this.retainTimeSkew = retainTimeSkew;
    }
    
    public Duration getTrashExpiration() {
        return trashExpiration;
    }
    
    /**
     * Sets how long trashed pieces stay restorable.
     * Default: 7 days
     */
    public void setTrashExpiration(Duration trashExpiration) {
        this.trashExpiration = trashExpiration;
    }
    
    public Duration getMaintenanceInterval() {
        return maintenanceInterval;
    }
    
    public void setMaintenanceInterval(Duration maintenanceInterval) {
        this.maintenanceInterval = maintenanceInterval;
    }
    
    /**
     * Base32 encoded public keys of trusted satellites.
     */
    public List<String> getTrustedSatellites() {
        return trustedSatellites;
    }
    
    public void setTrustedSatellites(List<String> trustedSatellites) {
        this.trustedSatellites = trustedSatellites;
    }
    
    @Override
    public String toString() {
        return "StorageNodeConfig{" +
                "storageDir=" + storageDir +
                ", port=" + port +
                ", workerThreads=" + workerThreads +
                ", streamTimeout=" + streamTimeout +
                ", orderLimitGracePeriod=" + orderLimitGracePeriod +
                ", maxDownloadChunkSize=" + maxDownloadChunkSize +
                ", retainStatus=" + retainStatus +
                ", retainTimeSkew=" + retainTimeSkew +
                ", trashExpiration=" + trashExpiration +
                ", trustedSatellites=" + trustedSatellites.size() +
                '}';
    }
}
