package dev.usageexporter.exporter;

import dev.usageexporter.core.ConfigurationException;
import dev.usageexporter.core.Instants;
import dev.usageexporter.core.SimpleVmRelabeler;
import dev.usageexporter.exporter.openstack.OpenStackCredentials;
import dev.usageexporter.simulator.UsageModel;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable exporter configuration, resolved once at startup.
 *
 * Every setting is taken from its command-line flag, else its environment variable, else its
 * default. Conflicting or invalid settings raise {@link ConfigurationException}.
 */
public final class ExporterConfig {
    public static final String DUMMY_FILE_ENV = "USAGE_EXPORTER_DUMMY_FILE";
    public static final String DUMMY_WEIGHTS_FILE_ENV = "USAGE_EXPORTER_DUMMY_WEIGHTS_FILE";
    public static final String PROJECT_DOMAINS_ENV = "USAGE_EXPORTER_PROJECT_DOMAINS";
    public static final String PROJECT_DOMAIN_ID_ENV = "USAGE_EXPORTER_PROJECT_DOMAIN_ID";
    public static final String SIMPLE_VM_PROJECT_ID_ENV = "USAGE_EXPORTER_SIMPLE_VM_PROJECT_ID";
    public static final String SIMPLE_VM_PROJECT_TAG_ENV = "USAGE_EXPORTER_SIMPLE_VM_PROJECT_TAG";
    public static final String WEIGHT_UPDATE_FREQUENCY_ENV = "USAGE_EXPORTER_WEIGHT_UPDATE_FREQUENCY";
    public static final String WEIGHTS_UPDATE_ENDPOINT_ENV = "USAGE_EXPORTER_WEIGHTS_UPDATE_ENDPOINT";
    public static final String START_DATE_ENDPOINT_ENV = "USAGE_EXPORTER_START_DATE_ENDPOINT";
    public static final String START_DATE_ENV = "USAGE_EXPORTER_START_DATE";
    public static final String UPDATE_INTERVAL_ENV = "USAGE_EXPORTER_UPDATE_INTERVAL";
    public static final String PORT_ENV = "USAGE_EXPORTER_PORT";
    public static final String REQUEST_TIMEOUT_ENV = "USAGE_EXPORTER_REQUEST_TIMEOUT";
    public static final String SIMULATION_MODEL_ENV = "USAGE_EXPORTER_SIMULATION_MODEL";

    static final int DEFAULT_WEIGHT_UPDATE_FREQUENCY = 10;
    static final int DEFAULT_UPDATE_INTERVAL_SECONDS = 300;
    static final int DEFAULT_PORT = 8080;
    static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;
    static final String DEFAULT_SIMULATION_MODEL = "allocation";

    public static final String USAGE = String.join("\n",
            "Usage: usage-exporter [options]",
            "",
            "Query project usage from an OpenStack instance and provide it in a Prometheus compatible format.",
            "",
            "  -d, --dummy-data PATH           simulate usage from a machine-lifetime TOML file (" + DUMMY_FILE_ENV + ")",
            "  -w, --dummy-weights PATH        static weights from a TOML file (" + DUMMY_WEIGHTS_FILE_ENV + ")",
            "      --domain [NAME...]          only export projects of these domains (" + PROJECT_DOMAINS_ENV + ", comma-separated)",
            "      --domain-id ID              only export projects of this domain id, overrides --domain (" + PROJECT_DOMAIN_ID_ENV + ")",
            "      --simple-vm-id ID           umbrella project hosting SimpleVM projects (" + SIMPLE_VM_PROJECT_ID_ENV + ")",
            "      --simple-vm-tag TAG         metadata key naming SimpleVM projects, default "
                    + SimpleVmRelabeler.DEFAULT_TAG + " (" + SIMPLE_VM_PROJECT_TAG_ENV + ")",
            "      --weight-update-frequency N refresh weights and start date every N updates, default "
                    + DEFAULT_WEIGHT_UPDATE_FREQUENCY + " (" + WEIGHT_UPDATE_FREQUENCY_ENV + ")",
            "      --weight-update-endpoint URL  fetch weights from this endpoint (" + WEIGHTS_UPDATE_ENDPOINT_ENV + ")",
            "      --start-date-endpoint URL   fetch the start date from this endpoint, overrides --start ("
                    + START_DATE_ENDPOINT_ENV + ")",
            "  -s, --start DATE                beginning of the usage window, default now (" + START_DATE_ENV + ")",
            "  -i, --update-interval SECONDS   time between updates, default "
                    + DEFAULT_UPDATE_INTERVAL_SECONDS + " (" + UPDATE_INTERVAL_ENV + ")",
            "  -p, --port PORT                 port serving /metrics, 0 picks a free one, default " + DEFAULT_PORT + " (" + PORT_ENV + ")",
            "      --request-timeout SECONDS   timeout of remote calls, default "
                    + DEFAULT_REQUEST_TIMEOUT_SECONDS + " (" + REQUEST_TIMEOUT_ENV + ")",
            "      --simulation-model MODEL    allocation or integrated, default "
                    + DEFAULT_SIMULATION_MODEL + " (" + SIMULATION_MODEL_ENV + ")",
            "  -h, --help                      show this help",
            "",
            "Without --dummy-data the variables " + OpenStackCredentials.TOKEN_ENV + ", "
                    + OpenStackCredentials.IDENTITY_ENDPOINT_ENV + " and "
                    + OpenStackCredentials.COMPUTE_ENDPOINT_ENV + " must be set.");

    public final boolean helpRequested;
    public final Path dummyDataFile;
    public final Path dummyWeightsFile;
    public final List<String> domainNames;
    public final String domainId;
    public final String simpleVmProjectId;
    public final String simpleVmTag;
    public final int weightUpdateFrequency;
    public final URI weightUpdateEndpoint;
    public final URI startDateEndpoint;
    public final Instant startDate;
    /** When the configuration was resolved; simulated machines without {@code started_at} start here. */
    public final Instant processStart;
    public final Duration updateInterval;
    public final int port;
    public final Duration requestTimeout;
    public final String simulationModel;
    public final OpenStackCredentials credentials;

    private ExporterConfig(Builder b) {
        this.helpRequested = b.helpRequested;
        this.dummyDataFile = b.dummyDataFile;
        this.dummyWeightsFile = b.dummyWeightsFile;
        this.domainNames = List.copyOf(b.domainNames);
        this.domainId = b.domainId;
        this.simpleVmProjectId = b.simpleVmProjectId;
        this.simpleVmTag = b.simpleVmTag;
        this.weightUpdateFrequency = b.weightUpdateFrequency;
        this.weightUpdateEndpoint = b.weightUpdateEndpoint;
        this.startDateEndpoint = b.startDateEndpoint;
        this.startDate = b.startDate;
        this.processStart = b.processStart;
        this.updateInterval = b.updateInterval;
        this.port = b.port;
        this.requestTimeout = b.requestTimeout;
        this.simulationModel = b.simulationModel;
        this.credentials = b.credentials;
    }

    public boolean isDummyMode() {
        return dummyDataFile != null;
    }

    public Optional<URI> weightUpdateEndpoint() {
        return Optional.ofNullable(weightUpdateEndpoint);
    }

    public Optional<URI> startDateEndpoint() {
        return Optional.ofNullable(startDateEndpoint);
    }

    /**
     * Resolve the configuration from command-line arguments and environment.
     *
     * @param now default start date when none is configured
     */
    public static ExporterConfig resolve(String[] args, Map<String, String> env, Instant now) {
        Map<String, List<String>> flags = parseFlags(args);
        Builder b = new Builder();
        b.processStart = now;
        if (flags.containsKey("help")) {
            b.helpRequested = true;
            return new ExporterConfig(b);
        }

        String dummyData = single(flags, env, "dummy-data", DUMMY_FILE_ENV);
        String dummyWeights = single(flags, env, "dummy-weights", DUMMY_WEIGHTS_FILE_ENV);
        String weightEndpoint = single(flags, env, "weight-update-endpoint", WEIGHTS_UPDATE_ENDPOINT_ENV);
        if (dummyWeights != null && weightEndpoint != null) {
            throw new ConfigurationException("--dummy-weights and --weight-update-endpoint are mutually exclusive");
        }

        b.dummyDataFile = dummyData == null ? null : existingFile(dummyData, "--dummy-data");
        b.dummyWeightsFile = dummyWeights == null ? null : existingFile(dummyWeights, "--dummy-weights");
        b.weightUpdateEndpoint = weightEndpoint == null ? null : httpUri(weightEndpoint, "--weight-update-endpoint");

        String startEndpoint = single(flags, env, "start-date-endpoint", START_DATE_ENDPOINT_ENV);
        b.startDateEndpoint = startEndpoint == null ? null : httpUri(startEndpoint, "--start-date-endpoint");

        if (flags.containsKey("domain")) {
            b.domainNames = flags.get("domain");
        } else if (env.get(PROJECT_DOMAINS_ENV) != null) {
            b.domainNames = splitComma(env.get(PROJECT_DOMAINS_ENV));
        }
        b.domainId = single(flags, env, "domain-id", PROJECT_DOMAIN_ID_ENV);
        b.simpleVmProjectId = single(flags, env, "simple-vm-id", SIMPLE_VM_PROJECT_ID_ENV);
        String tag = single(flags, env, "simple-vm-tag", SIMPLE_VM_PROJECT_TAG_ENV);
        b.simpleVmTag = tag == null ? SimpleVmRelabeler.DEFAULT_TAG : tag;

        b.weightUpdateFrequency = positiveInt(flags, env, "weight-update-frequency", WEIGHT_UPDATE_FREQUENCY_ENV,
                DEFAULT_WEIGHT_UPDATE_FREQUENCY);
        b.updateInterval = Duration.ofSeconds(positiveInt(flags, env, "update-interval", UPDATE_INTERVAL_ENV,
                DEFAULT_UPDATE_INTERVAL_SECONDS));
        b.requestTimeout = Duration.ofSeconds(positiveInt(flags, env, "request-timeout", REQUEST_TIMEOUT_ENV,
                DEFAULT_REQUEST_TIMEOUT_SECONDS));
        b.port = intSetting(flags, env, "port", PORT_ENV, DEFAULT_PORT, 0);
        if (b.port > 65535) {
            throw new ConfigurationException("--port must be at most 65535, got " + b.port);
        }

        String start = single(flags, env, "start", START_DATE_ENV);
        try {
            b.startDate = start == null ? now : Instants.parse(start);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("--start: " + e.getMessage(), e);
        }

        String model = single(flags, env, "simulation-model", SIMULATION_MODEL_ENV);
        b.simulationModel = model == null ? DEFAULT_SIMULATION_MODEL : model.trim();
        try {
            UsageModel.named(b.simulationModel);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        if (b.dummyDataFile == null) {
            try {
                b.credentials = OpenStackCredentials.fromEnvironment(env);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid OpenStack endpoint: " + e.getMessage(), e);
            }
            if (b.credentials == null) {
                throw new ConfigurationException("Could not authenticate against OpenStack: set "
                        + OpenStackCredentials.TOKEN_ENV + ", " + OpenStackCredentials.IDENTITY_ENDPOINT_ENV
                        + " and " + OpenStackCredentials.COMPUTE_ENDPOINT_ENV
                        + ", or use --dummy-data for testing");
            }
        }
        return new ExporterConfig(b);
    }

    // ===== Flag parsing =====

    private static final Map<String, String> SHORT_FLAGS = Map.of(
            "-d", "dummy-data",
            "-w", "dummy-weights",
            "-s", "start",
            "-i", "update-interval",
            "-p", "port",
            "-h", "help");

    private static final List<String> VALUE_FLAGS = List.of(
            "dummy-data", "dummy-weights", "domain-id", "simple-vm-id", "simple-vm-tag",
            "weight-update-frequency", "weight-update-endpoint", "start-date-endpoint", "start",
            "update-interval", "port", "request-timeout", "simulation-model");

    /**
     * Long name to values. {@code --domain} takes any number of values, {@code --help} none,
     * every other flag exactly one; {@code --flag=value} is accepted too.
     */
    static Map<String, List<String>> parseFlags(String[] args) {
        Map<String, List<String>> flags = new HashMap<>();
        List<String> remaining = new ArrayList<>(Arrays.asList(args));
        while (!remaining.isEmpty()) {
            String arg = remaining.remove(0);
            String inlineValue = null;
            String name;
            if (arg.startsWith("--")) {
                name = arg.substring(2);
                int eq = name.indexOf('=');
                if (eq >= 0) {
                    inlineValue = name.substring(eq + 1);
                    name = name.substring(0, eq);
                }
            } else if (SHORT_FLAGS.containsKey(arg)) {
                name = SHORT_FLAGS.get(arg);
            } else {
                throw new ConfigurationException("Unexpected argument '" + arg + "'");
            }

            if ("help".equals(name)) {
                flags.put(name, List.of());
            } else if ("domain".equals(name)) {
                List<String> values = new ArrayList<>();
                if (inlineValue != null) {
                    values.addAll(splitComma(inlineValue));
                }
                while (!remaining.isEmpty() && !remaining.get(0).startsWith("-")) {
                    values.add(remaining.remove(0));
                }
                flags.put(name, values);
            } else if (VALUE_FLAGS.contains(name)) {
                String value = inlineValue;
                if (value == null) {
                    if (remaining.isEmpty()) {
                        throw new ConfigurationException("Missing value for --" + name);
                    }
                    value = remaining.remove(0);
                }
                flags.put(name, List.of(value));
            } else {
                throw new ConfigurationException("Unknown option '" + arg + "'");
            }
        }
        return flags;
    }

    private static String single(Map<String, List<String>> flags, Map<String, String> env,
                                 String flag, String envVar) {
        String value = flags.containsKey(flag) ? flags.get(flag).get(0) : env.get(envVar);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int positiveInt(Map<String, List<String>> flags, Map<String, String> env,
                                   String flag, String envVar, int fallback) {
        return intSetting(flags, env, flag, envVar, fallback, 1);
    }

    private static int intSetting(Map<String, List<String>> flags, Map<String, String> env,
                                  String flag, String envVar, int fallback, int min) {
        String value = single(flags, env, flag, envVar);
        if (value == null) {
            return fallback;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("--" + flag + " must be an integer, got '" + value + "'", e);
        }
        if (parsed < min) {
            throw new ConfigurationException("--" + flag + " must be at least " + min + ", got " + parsed);
        }
        return parsed;
    }

    private static List<String> splitComma(String value) {
        List<String> parts = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts;
    }

    private static Path existingFile(String value, String flag) {
        Path path = Path.of(value);
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new ConfigurationException(flag + ": cannot read file " + path);
        }
        return path;
    }

    private static URI httpUri(String value, String flag) {
        URI uri;
        try {
            uri = URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(flag + ": invalid URL '" + value + "'", e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new ConfigurationException(flag + ": expected an http(s) URL, got '" + value + "'");
        }
        return uri;
    }

    @Override
    public String toString() {
        return String.format("mode=%s, domains=%s, domainId=%s, simpleVm=%s/%s, weights=%s, startDate=%s, "
                        + "interval=%ss, weightUpdateFrequency=%d, port=%d",
                isDummyMode() ? "dummy(" + dummyDataFile + ", " + simulationModel + ")" : "openstack",
                domainNames, domainId, simpleVmProjectId, simpleVmTag,
                dummyWeightsFile != null ? dummyWeightsFile : weightUpdateEndpoint != null ? weightUpdateEndpoint : "neutral",
                startDateEndpoint != null ? startDateEndpoint : startDate,
                updateInterval.toSeconds(), weightUpdateFrequency, port);
    }

    private static final class Builder {
        boolean helpRequested;
        Path dummyDataFile;
        Path dummyWeightsFile;
        List<String> domainNames = List.of();
        String domainId;
        String simpleVmProjectId;
        String simpleVmTag = SimpleVmRelabeler.DEFAULT_TAG;
        int weightUpdateFrequency = DEFAULT_WEIGHT_UPDATE_FREQUENCY;
        URI weightUpdateEndpoint;
        URI startDateEndpoint;
        Instant startDate;
        Instant processStart;
        Duration updateInterval = Duration.ofSeconds(DEFAULT_UPDATE_INTERVAL_SECONDS);
        int port = DEFAULT_PORT;
        Duration requestTimeout = Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
        String simulationModel = DEFAULT_SIMULATION_MODEL;
        OpenStackCredentials credentials;
    }
}
