package org.muma.minikv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * 全局配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (minikv.properties) > 默认值
 * 启动完成后只读。
 */
@Getter
@Setter
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);

    public static final int DEFAULT_PORT = 6379;
    public static final String DEFAULT_CONFIG_FILE = "minikv.properties";

    // --- Core Settings ---
    private int port = DEFAULT_PORT;

    // --- Snapshot (RDB) ---
    private String dir;
    private String dbFilename;

    // --- Replication ---
    private String replicaOfHost;
    private int replicaOfPort = -1;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // --- Loading Logic ---

    /**
     * 完整加载流程：配置文件 -> 环境变量 -> 命令行参数
     */
    public static MiniKvConfig fromArgs(String[] args) {
        MiniKvConfig config = new MiniKvConfig();
        // 先扫一遍 --config，决定读哪个配置文件
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equalsIgnoreCase(args[i])) {
                config.configFilePath = args[i + 1];
            }
        }
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides();
        config.parseArgs(args);
        log.info("MiniKvConfig initialized: {}", config);
        return config;
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i].toLowerCase(Locale.ROOT);
            boolean hasValue = i + 1 < args.length;
            switch (arg) {
                case "--config" -> {
                    if (hasValue) i++;
                }
                case "--port" -> {
                    if (hasValue) this.port = parsePort(args[++i]);
                }
                case "--dir" -> {
                    if (hasValue) this.dir = args[++i];
                }
                case "--dbfilename" -> {
                    if (hasValue) this.dbFilename = args[++i];
                }
                case "--replicaof" -> {
                    if (!hasValue) break;
                    String value = args[++i];
                    // 两种写法: --replicaof "host port" 或 --replicaof host port
                    if (value.trim().contains(" ")) {
                        setReplicaOf(value);
                    } else {
                        int masterPort = DEFAULT_PORT;
                        if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                            masterPort = parsePort(args[++i]);
                        }
                        this.replicaOfHost = value;
                        this.replicaOfPort = masterPort;
                    }
                }
                default -> log.warn("Ignoring unknown argument: {}", args[i]);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.port = getInt(props, "port", this.port);
        this.dir = props.getProperty("dir", this.dir);
        this.dbFilename = props.getProperty("dbfilename", this.dbFilename);

        // 格式: replicaof <host> <port> (中间用空格分隔)
        String replicaOf = props.getProperty("replicaof", "");
        if (!replicaOf.isEmpty()) {
            setReplicaOf(replicaOf);
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else if (new File(path).isFile()) {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                }
            } else {
                log.debug("Config file not found: {}, using defaults.", path);
            }
        } catch (IOException e) {
            log.error("Error loading config {}", path, e);
        }
        return props;
    }

    private void applyEnvOverrides() {
        String envPort = System.getenv("MINIKV_PORT");
        if (envPort != null) {
            this.port = parsePort(envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }
    }

    private void setReplicaOf(String value) {
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid replicaof format: '" + value + "', expected '<host> <port>'");
        }
        this.replicaOfHost = parts[0];
        this.replicaOfPort = parsePort(parts[1]);
    }

    private static int parsePort(String value) {
        try {
            int port = Integer.parseInt(value.trim());
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + value);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value, e);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parsePort(val) : defaultValue;
    }

    // --- Derived values ---

    public boolean isReplica() {
        return replicaOfHost != null;
    }

    /**
     * dir 和 dbfilename 都配置时才有快照文件
     */
    public Optional<File> getSnapshotFile() {
        if (dir == null || dbFilename == null) {
            return Optional.empty();
        }
        return Optional.of(new File(dir, dbFilename));
    }

    /**
     * CONFIG GET 支持的参数，其余返回 null
     */
    public String get(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "dir" -> dir;
            case "dbfilename" -> dbFilename;
            default -> null;
        };
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", dir=" + dir + ", dbfilename=" + dbFilename
                + ", replicaof=" + (isReplica() ? replicaOfHost + ":" + replicaOfPort : "none") + "}";
    }
}
