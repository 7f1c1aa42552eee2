package com.questrail.mitm.config;

import com.questrail.mitm.attack.AttackConfig;
import com.questrail.mitm.attack.AttackMode;
import com.questrail.mitm.detection.DetectionConfig;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * SimulationConfigLoader
 * =============================================================================
 * Builds a {@link SimulationConfig} from flat string options.
 *
 * <h2>Accepted names</h2>
 * Option names ({@code mode}, {@code delay_min}, …) via
 * {@link #fromOptions(Map)}, or deployment environment names
 * ({@code PROXY_MODE}, {@code SERVER_MAX_DELAY}, …) via
 * {@link #fromEnvironment(Map)}. Missing values take the factory defaults.
 *
 * <h2>Failure</h2>
 * Every problem (unknown option, unparsable value, constraint violation) is a
 * {@link ConfigurationException} naming the option. Nothing is bound or
 * connected before loading succeeds.
 */
public final class SimulationConfigLoader
{
    public static final String MODE = "mode";
    public static final String DELAY_MIN = "delay_min";
    public static final String DELAY_MAX = "delay_max";
    public static final String DROP_RATE = "drop_rate";
    public static final String REORDER_WINDOW = "reorder_window";
    public static final String MAX_DELAY = "max_delay";
    public static final String DETECTION_ENABLED = "detection_enabled";
    public static final String REPLAY_WINDOW = "replay_window";
    public static final String MESSAGE_INTERVAL = "message_interval";
    public static final String PAYLOAD = "payload";
    public static final String MESSAGE_LIMIT = "message_limit";
    public static final String USE_RELAY = "use_relay";
    public static final String RELAY_HOST = "relay_host";
    public static final String RELAY_PORT = "relay_port";
    public static final String DESTINATION_HOST = "destination_host";
    public static final String DESTINATION_PORT = "destination_port";
    public static final String MAX_FRAME_LENGTH = "max_frame_length";
    public static final String LOG_TAIL = "log_tail";

    private static final Set<String> OPTIONS = Set.of(
            MODE, DELAY_MIN, DELAY_MAX, DROP_RATE, REORDER_WINDOW, MAX_DELAY, DETECTION_ENABLED,
            REPLAY_WINDOW, MESSAGE_INTERVAL, PAYLOAD, MESSAGE_LIMIT, USE_RELAY, RELAY_HOST,
            RELAY_PORT, DESTINATION_HOST, DESTINATION_PORT, MAX_FRAME_LENGTH, LOG_TAIL);

    /** Environment variable name → option name. */
    private static final Map<String, String> ENVIRONMENT_NAMES;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("PROXY_MODE", MODE);
        m.put("PROXY_DELAY_MIN", DELAY_MIN);
        m.put("PROXY_DELAY_MAX", DELAY_MAX);
        m.put("PROXY_DROP_RATE", DROP_RATE);
        m.put("PROXY_REORDER_WINDOW", REORDER_WINDOW);
        m.put("PROXY_LISTEN_HOST", RELAY_HOST);
        m.put("PROXY_LISTEN_PORT", RELAY_PORT);
        m.put("PROXY_BUFFER_SIZE", MAX_FRAME_LENGTH);
        m.put("SERVER_MAX_DELAY", MAX_DELAY);
        m.put("SERVER_DETECTION_ENABLED", DETECTION_ENABLED);
        m.put("SERVER_REPLAY_WINDOW", REPLAY_WINDOW);
        m.put("SERVER_LISTEN_HOST", DESTINATION_HOST);
        m.put("SERVER_LISTEN_PORT", DESTINATION_PORT);
        m.put("CLIENT_MESSAGE_INTERVAL", MESSAGE_INTERVAL);
        m.put("CLIENT_MESSAGE_PAYLOAD", PAYLOAD);
        m.put("CLIENT_MESSAGE_LIMIT", MESSAGE_LIMIT);
        m.put("USE_PROXY", USE_RELAY);
        m.put("STATUS_LOG_TAIL", LOG_TAIL);
        ENVIRONMENT_NAMES = Map.copyOf(m);
    }

    private SimulationConfigLoader() {}

    /**
     * Load from option names. Unknown names are rejected.
     */
    public static SimulationConfig fromOptions(Map<String, String> options)
    {
        Objects.requireNonNull(options, "options");
        for (String key : options.keySet()) {
            if (!OPTIONS.contains(key)) {
                throw new ConfigurationException("Unknown option '" + key + "'");
            }
        }
        return load(options);
    }

    /**
     * Load from deployment environment names. Unrelated variables are ignored.
     */
    public static SimulationConfig fromEnvironment(Map<String, String> environment)
    {
        Objects.requireNonNull(environment, "environment");
        Map<String, String> options = new HashMap<>();
        for (Map.Entry<String, String> e : ENVIRONMENT_NAMES.entrySet()) {
            String value = environment.get(e.getKey());
            if (value != null) {
                options.put(e.getValue(), value);
            }
        }
        return load(options);
    }

    public static SimulationConfig fromEnvironment()
    {
        return fromEnvironment(System.getenv());
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private static SimulationConfig load(Map<String, String> o)
    {
        AttackConfig attackDefaults = AttackConfig.defaults();
        DetectionConfig detectionDefaults = DetectionConfig.defaults();
        SourceConfig sourceDefaults = SourceConfig.defaults();
        NetworkConfig networkDefaults = NetworkConfig.defaults();

        AttackMode mode = mode(o, attackDefaults.mode());

        AttackConfig attack = build(() -> AttackConfig.builder()
                .withMode(mode)
                .withDelayBounds(
                        seconds(o, DELAY_MIN, attackDefaults.delayMin()),
                        seconds(o, DELAY_MAX, attackDefaults.delayMax()))
                .withDropRate(decimal(o, DROP_RATE, attackDefaults.dropRate()))
                .withReorderWindow(integer(o, REORDER_WINDOW, attackDefaults.reorderWindow()))
                .build());

        DetectionConfig detection = build(() -> new DetectionConfig(
                bool(o, DETECTION_ENABLED, detectionDefaults.enabled()),
                decimal(o, MAX_DELAY, detectionDefaults.maxDelaySeconds()),
                integer(o, REPLAY_WINDOW, detectionDefaults.replayWindow()),
                detectionDefaults.initialSequence()));

        SourceConfig source = build(() -> new SourceConfig(
                seconds(o, MESSAGE_INTERVAL, sourceDefaults.messageInterval()),
                o.getOrDefault(PAYLOAD, sourceDefaults.payload()),
                integer(o, MESSAGE_LIMIT, (int) sourceDefaults.messageLimit())));

        NetworkConfig network = build(() -> new NetworkConfig(
                address(o, RELAY_HOST, RELAY_PORT, networkDefaults.relayListen()),
                address(o, DESTINATION_HOST, DESTINATION_PORT, networkDefaults.destinationListen()),
                integer(o, MAX_FRAME_LENGTH, networkDefaults.maxFrameLength()),
                networkDefaults.connectTimeoutMillis()));

        return build(() -> SimulationConfig.builder()
                .withAttack(attack)
                .withDetection(detection)
                .withSource(source)
                .withNetwork(network)
                .withUseRelay(bool(o, USE_RELAY, true))
                .withLogTailCapacity(integer(o, LOG_TAIL, SimulationConfig.DEFAULT_LOG_TAIL_CAPACITY))
                .build());
    }

    @FunctionalInterface
    private interface Step<T> {
        T get();
    }

    /** Record constructors report violations as IllegalArgumentException. */
    private static <T> T build(Step<T> step)
    {
        try {
            return step.get();
        } catch (ConfigurationException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static AttackMode mode(Map<String, String> o, AttackMode fallback)
    {
        String raw = o.get(MODE);
        if (raw == null) {
            return fallback;
        }
        try {
            return AttackMode.fromWireName(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(MODE + ": " + e.getMessage(), e);
        }
    }

    private static double decimal(Map<String, String> o, String key, double fallback)
    {
        String raw = o.get(key);
        if (raw == null) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (!Double.isFinite(value)) {
                throw new ConfigurationException(key + ": not a finite number: '" + raw + "'");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + ": not a number: '" + raw + "'", e);
        }
    }

    private static Duration seconds(Map<String, String> o, String key, Duration fallback)
    {
        if (!o.containsKey(key)) {
            return fallback;
        }
        double value = decimal(o, key, 0.0);
        if (value < 0) {
            throw new ConfigurationException(key + ": must be >= 0: " + value);
        }
        return Duration.ofNanos(Math.round(value * 1_000_000_000.0));
    }

    private static int integer(Map<String, String> o, String key, int fallback)
    {
        String raw = o.get(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + ": not an integer: '" + raw + "'", e);
        }
    }

    private static boolean bool(Map<String, String> o, String key, boolean fallback)
    {
        String raw = o.get(key);
        if (raw == null) {
            return fallback;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new ConfigurationException(key + ": expected true or false: '" + raw + "'");
        }
    }

    private static InetSocketAddress address(Map<String, String> o, String hostKey, String portKey,
                                             InetSocketAddress fallback)
    {
        String host = o.getOrDefault(hostKey, fallback.getHostString());
        int port = integer(o, portKey, fallback.getPort());
        if (port < 0 || port > 65535) {
            throw new ConfigurationException(portKey + ": out of range: " + port);
        }
        return new InetSocketAddress(host, port);
    }
}
