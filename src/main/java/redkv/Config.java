package redkv;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import redkv.protocol.BatchRespDecoder;
import redkv.protocol.FrameDecoder;
import redkv.protocol.RespDecoder;
import redkv.utils.Log;

public class Config {
    public static final String CODEC_INCREMENTAL = "incremental";
    public static final String CODEC_BATCH = "batch";

    public int port = 6379;
    public String host = "0.0.0.0";
    public String codec = CODEC_INCREMENTAL;
    public long maxFrameBytes = 512L * 1024 * 1024; // 512MB, the largest bulk string Redis accepts
    public int workerThreads = 0; // 0 = Netty default
    public String logLevel = "info";
    public int statsIntervalSeconds = 5;

    public Config() {
        // Default constructor for Jackson
    }

    public static Config load(String filename) {
        return load(filename, System.getenv());
    }

    static Config load(String filename, Map<String, String> env) {
        File f = new File(filename);
        if (!f.exists() && filename.endsWith(".conf")) {
            File yamlFile = new File(filename.substring(0, filename.length() - 5) + ".yaml");
            if (yamlFile.exists()) f = yamlFile;
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                Config parsed = mapper.readValue(f, Config.class);
                if (parsed != null) config = parsed;
            } catch (IOException e) {
                Log.warn("Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
                config = loadLegacy(f, new Config());
            }
        }

        if (env.get("REDKV_PORT") != null) {
            config.port = Integer.parseInt(env.get("REDKV_PORT").trim());
        }
        if (env.get("REDKV_LOG_LEVEL") != null) {
            config.logLevel = env.get("REDKV_LOG_LEVEL").trim();
        }

        config.validate();
        return config;
    }

    // "key value" lines, '#' starts a comment
    static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;

                String key = parts[0];
                String val = parts[1];

                switch (key) {
                    case "port": config.port = Integer.parseInt(val); break;
                    case "bind":
                    case "host": config.host = val; break;
                    case "codec": config.codec = val; break;
                    case "max-frame-bytes":
                    case "maxFrameBytes": config.maxFrameBytes = parseMemory(val); break;
                    case "worker-threads":
                    case "workerThreads": config.workerThreads = Integer.parseInt(val); break;
                    case "loglevel":
                    case "logLevel": config.logLevel = val; break;
                    case "stats-interval":
                    case "statsIntervalSeconds": config.statsIntervalSeconds = Integer.parseInt(val); break;
                    default: Log.warn("Unknown config key ignored: " + key);
                }
            }
        } catch (IOException e) {
            Log.error("Failed to read config " + f + ": " + e.getMessage());
        }
        return config;
    }

    static long parseMemory(String val) {
        val = val.trim().toLowerCase();
        long mult = 1;
        if (val.endsWith("gb")) { mult = 1024L * 1024 * 1024; val = val.substring(0, val.length() - 2); }
        else if (val.endsWith("mb")) { mult = 1024L * 1024; val = val.substring(0, val.length() - 2); }
        else if (val.endsWith("kb")) { mult = 1024L; val = val.substring(0, val.length() - 2); }
        return Long.parseLong(val.trim()) * mult;
    }

    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (!CODEC_INCREMENTAL.equals(codec) && !CODEC_BATCH.equals(codec)) {
            throw new IllegalArgumentException("unknown codec: " + codec);
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive: " + maxFrameBytes);
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must not be negative: " + workerThreads);
        }
        if (statsIntervalSeconds < 0) {
            throw new IllegalArgumentException("statsIntervalSeconds must not be negative: " + statsIntervalSeconds);
        }
        Log.parseLevel(logLevel);
    }

    public FrameDecoder newFrameDecoder() {
        return CODEC_BATCH.equals(codec) ? new BatchRespDecoder() : new RespDecoder();
    }
}
