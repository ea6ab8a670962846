package org.carma.deception.config;

import org.carma.deception.model.*;
import org.carma.deception.safety.InvalidParametersException;
import org.carma.deception.safety.ParameterValidator;
import org.carma.deception.safety.ParameterValidator.ValidationError;
import org.carma.deception.simulation.SweepVariable;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Loads equilibrium scenarios from YAML files.
 *
 * A scenario file names every run parameter with the same keys the solver reports:
 * <pre>
 * name: two-real-two-decoy
 * D: 1
 * M: 1
 * PT: [10]
 * PJ: [10]
 * sigma2: 1
 * tau: 0.2
 * alpha: 0.3
 * maxIter: 100
 * epsilon: 0.001
 * channelConfig:
 *   - {type: real, owner: 0}
 *   - {type: decoy, owner: 0}
 * jammerStrategy: uniform        # uniform | topK | gradient
 * jammerObjective: deception     # deception | oracle
 * attackerMode: coordinated      # coordinated | independent
 * gainDistribution: rayleigh     # optional; unit gains when h/g are absent
 * compare: true                  # optional oracle / no-decoy comparison
 * sweep: {variable: ND, min: 0, max: 4, step: 1}
 * </pre>
 *
 * Directory structure:
 * <pre>
 * scenarios/
 *   two-real-two-decoy/
 *     scenario.yaml
 * </pre>
 *
 * Parse problems (wrong types, unknown enum keys) and range problems are both reported
 * as an {@link InvalidParametersException} listing each offending field.
 */
public class ScenarioConfigLoader {

    public static final String SCENARIO_FILE = "scenario.yaml";

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    /**
     * Root configuration for a scenario.
     */
    public static class ScenarioConfig {
        public String name;
        public String description;
        public EquilibriumParams params;
        public boolean compare;
        public SweepConfig sweep;

        @Override
        public String toString() {
            return String.format("ScenarioConfig[name=%s, %s]", name, params);
        }
    }

    /**
     * Optional parameter sweep attached to a scenario.
     */
    public static class SweepConfig {
        public SweepVariable variable;
        public double min;
        public double max;
        public double step = 1.0;
        public int threads = Runtime.getRuntime().availableProcessors();

        public List<Double> range() {
            List<Double> values = new ArrayList<>();
            if (step <= 0) return values;
            // Small tolerance so a fractional step still lands on max
            for (double v = min; v <= max + step * 1e-9; v += step) {
                values.add(v);
            }
            return values;
        }

        @Override
        public String toString() {
            return String.format("SweepConfig[%s %s..%s step %s]", variable, min, max, step);
        }
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;
    private final ParameterValidator validator;

    public ScenarioConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
        this.validator = new ParameterValidator();
    }

    /**
     * Load a scenario from a YAML file, or from a directory containing scenario.yaml.
     */
    public ScenarioConfig loadScenario(Path path) throws IOException {
        Path scenarioFile = Files.isDirectory(path) ? path.resolve(SCENARIO_FILE) : path;
        if (!Files.exists(scenarioFile)) {
            throw new IOException("Scenario file not found: " + scenarioFile);
        }

        try (InputStream is = Files.newInputStream(scenarioFile)) {
            return load(is);
        }
    }

    /**
     * Load a scenario bundled on the classpath, e.g. "scenarios/default/scenario.yaml".
     */
    public ScenarioConfig loadResource(String resource) throws IOException {
        try (InputStream is = ScenarioConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Scenario resource not found: " + resource);
            }
            return load(is);
        }
    }

    public ScenarioConfig load(InputStream is) {
        Object raw = yaml.load(is);
        if (!(raw instanceof Map)) {
            throw new InvalidParametersException(List.of(
                new ValidationError("scenario", "must be a YAML mapping")));
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) raw;
        return parseScenarioConfig(map);
    }

    public ScenarioConfig load(String yamlText) {
        return load(new ByteArrayInputStream(yamlText.getBytes(java.nio.charset.StandardCharsets.UTF_8)));
    }

    // ========================================================================
    // PARSING
    // ========================================================================

    private ScenarioConfig parseScenarioConfig(Map<String, Object> raw) {
        List<ValidationError> errors = new ArrayList<>();
        ScenarioConfig config = new ScenarioConfig();

        config.name = getString(raw, "name", "unnamed");
        config.description = getString(raw, "description", "");
        config.compare = getBoolean(raw, "compare", false, errors);

        int d = getInt(raw, "D", 1, errors);
        int m = getInt(raw, "M", 1, errors);
        Long seed = raw.containsKey("seed") ? getLong(raw, "seed", 0L, errors) : null;

        List<ChannelConfig> channels = parseChannels(raw, d, errors);
        int n = raw.containsKey("N") ? getInt(raw, "N", channels.size(), errors) : channels.size();
        if (channels.isEmpty() && !raw.containsKey("channelConfig") && n > 0) {
            channels = DefaultScenarios.defaultChannelLayout(n, Math.max(1, d));
        }

        EquilibriumParams.Builder builder = new EquilibriumParams.Builder()
            .players(d, m)
            .channels(channels)
            .numChannels(n)
            .budgets(getDoubleArray(raw, "PT", d, DefaultScenarios.DEFAULT_BUDGET, errors),
                     getDoubleArray(raw, "PJ", m, DefaultScenarios.DEFAULT_BUDGET, errors))
            .noisePower(getDouble(raw, "sigma2", 1.0, errors))
            .sensingThreshold(getDouble(raw, "tau", 0.2, errors))
            .damping(getDouble(raw, "alpha", 0.3, errors))
            .maxIterations(getInt(raw, "maxIter", 100, errors))
            .epsilon(getDouble(raw, "epsilon", 0.001, errors))
            .topK(getInt(raw, "topK", 3, errors))
            .randomInit(getBoolean(raw, "randomInit", false, errors))
            .gainWeightedInit(getBoolean(raw, "gainWeightedInit", false, errors))
            .seed(seed)
            .jammerStrategy(getEnum(raw, "jammerStrategy", JammerStrategy.UNIFORM,
                JammerStrategy::fromKey, "uniform, topK, or gradient", errors))
            .jammerObjective(getEnum(raw, "jammerObjective", JammerObjective.DECEPTION,
                JammerObjective::fromKey, "deception or oracle", errors))
            .attackerMode(getEnum(raw, "attackerMode", AttackerMode.COORDINATED,
                AttackerMode::fromKey, "coordinated or independent", errors));

        parseGains(raw, builder, n, d, m, seed, errors);
        config.sweep = parseSweep(raw, errors);

        if (!errors.isEmpty()) {
            throw new InvalidParametersException(errors);
        }

        config.params = builder.build();
        validator.validateOrThrow(config.params);
        return config;
    }

    @SuppressWarnings("unchecked")
    private List<ChannelConfig> parseChannels(Map<String, Object> raw, int numDefenders,
                                              List<ValidationError> errors) {
        List<ChannelConfig> channels = new ArrayList<>();
        Object value = raw.get("channelConfig");
        if (value == null) return channels;
        if (!(value instanceof List)) {
            errors.add(new ValidationError("channelConfig", "must be a list of {type, owner} entries"));
            return channels;
        }

        List<Object> list = (List<Object>) value;
        for (int i = 0; i < list.size(); i++) {
            String field = "channelConfig[" + i + "]";
            Object entry = list.get(i);
            if (!(entry instanceof Map)) {
                errors.add(new ValidationError(field, "must be a {type, owner} mapping"));
                continue;
            }
            Map<String, Object> map = (Map<String, Object>) entry;
            String typeKey = getString(map, "type", null);
            ChannelType type = ChannelType.fromKey(typeKey);
            if (type == null) {
                errors.add(new ValidationError(field + ".type",
                    "must be real, decoy, or inactive, got " + typeKey));
            }
            int owner = getInt(map, "owner", i % Math.max(1, numDefenders), errors);
            channels.add(new ChannelConfig(type, owner));
        }
        return channels;
    }

    private void parseGains(Map<String, Object> raw, EquilibriumParams.Builder builder,
                            int n, int d, int m, Long seed, List<ValidationError> errors) {
        GainDistribution distribution = raw.containsKey("gainDistribution")
            ? getEnum(raw, "gainDistribution", null, GainDistribution::fromKey,
                "uniform, rayleigh, or custom", errors)
            : null;

        boolean hasH = raw.containsKey("h");
        boolean hasG = raw.containsKey("g");

        if (hasH || hasG) {
            if (!(hasH && hasG)) {
                errors.add(new ValidationError(hasH ? "g" : "h", "must be given together with "
                    + (hasH ? "h" : "g")));
                return;
            }
            builder.gains(getMatrix(raw, "h", errors), getMatrix(raw, "g", errors));
            return;
        }

        if (distribution == GainDistribution.CUSTOM) {
            errors.add(new ValidationError("h", "custom gain distribution requires explicit h and g"));
            return;
        }
        if (n <= 0 || d <= 0 || m <= 0) {
            // sizes are reported by the validator
            builder.gains(new double[0][], new double[0][]);
            return;
        }
        if (distribution == null) {
            builder.unitGains();
            return;
        }

        DefaultScenarios.GainMatrices gains = DefaultScenarios.randomGains(n, d, m, distribution, seed);
        builder.gains(gains.getDefenderGains(), gains.getAttackerGains());
    }

    @SuppressWarnings("unchecked")
    private SweepConfig parseSweep(Map<String, Object> raw, List<ValidationError> errors) {
        Object value = raw.get("sweep");
        if (value == null) return null;
        if (!(value instanceof Map)) {
            errors.add(new ValidationError("sweep", "must be a mapping with variable, min, max, step"));
            return null;
        }
        Map<String, Object> map = (Map<String, Object>) value;
        SweepConfig sweep = new SweepConfig();
        String key = getString(map, "variable", null);
        sweep.variable = SweepVariable.fromKey(key);
        if (sweep.variable == null) {
            errors.add(new ValidationError("sweep.variable", "must be one of ND, tau, N, M, D, PJ, got " + key));
        }
        sweep.min = getDouble(map, "min", 0, errors);
        sweep.max = getDouble(map, "max", sweep.min, errors);
        sweep.step = getDouble(map, "step", 1.0, errors);
        sweep.threads = getInt(map, "threads", sweep.threads, errors);
        if (sweep.step <= 0) {
            errors.add(new ValidationError("sweep.step", "must be positive"));
        }
        return sweep;
    }

    // ========================================================================
    // UTILITY METHODS
    // ========================================================================

    /**
     * List scenario directories (those containing scenario.yaml) under a root.
     */
    public List<String> listScenarios(Path scenariosRoot) throws IOException {
        if (!Files.exists(scenariosRoot)) {
            return Collections.emptyList();
        }

        List<String> scenarios = new ArrayList<>();
        try (var stream = Files.list(scenariosRoot)) {
            stream.filter(Files::isDirectory)
                  .filter(p -> Files.exists(p.resolve(SCENARIO_FILE)))
                  .map(p -> p.getFileName().toString())
                  .sorted()
                  .forEach(scenarios::add);
        }
        return scenarios;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue, List<ValidationError> errors) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) {
            Number number = (Number) value;
            double v = number.doubleValue();
            if (v == Math.rint(v) && v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) {
                return number.intValue();
            }
        }
        errors.add(new ValidationError(key, "must be an integer, got " + value));
        return defaultValue;
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue, List<ValidationError> errors) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        errors.add(new ValidationError(key, "must be a 64-bit integer, got " + value));
        return defaultValue;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue,
                             List<ValidationError> errors) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        errors.add(new ValidationError(key, "must be a number, got " + value));
        return defaultValue;
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue,
                               List<ValidationError> errors) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        errors.add(new ValidationError(key, "must be true or false, got " + value));
        return defaultValue;
    }

    private <E> E getEnum(Map<String, Object> map, String key, E defaultValue,
                          java.util.function.Function<String, E> parser, String allowed,
                          List<ValidationError> errors) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        E parsed = parser.apply(value.toString());
        if (parsed == null) {
            errors.add(new ValidationError(key, "must be " + allowed + ", got " + value));
            return defaultValue;
        }
        return parsed;
    }

    @SuppressWarnings("unchecked")
    private double[] getDoubleArray(Map<String, Object> map, String key, int defaultLength,
                                    double defaultValue, List<ValidationError> errors) {
        Object value = map.get(key);
        if (value == null) {
            double[] out = new double[Math.max(0, defaultLength)];
            Arrays.fill(out, defaultValue);
            return out;
        }
        if (!(value instanceof List)) {
            errors.add(new ValidationError(key, "must be a list of numbers"));
            return new double[0];
        }
        return toDoubles((List<Object>) value, key, errors);
    }

    @SuppressWarnings("unchecked")
    private double[][] getMatrix(Map<String, Object> map, String key, List<ValidationError> errors) {
        Object value = map.get(key);
        if (!(value instanceof List)) {
            errors.add(new ValidationError(key, "must be a list of rows"));
            return new double[0][];
        }
        List<Object> rows = (List<Object>) value;
        double[][] out = new double[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            Object row = rows.get(r);
            if (!(row instanceof List)) {
                errors.add(new ValidationError(key + "[" + r + "]", "must be a list of numbers"));
                out[r] = new double[0];
                continue;
            }
            out[r] = toDoubles((List<Object>) row, key + "[" + r + "]", errors);
        }
        return out;
    }

    private double[] toDoubles(List<Object> list, String field, List<ValidationError> errors) {
        double[] out = new double[list.size()];
        for (int i = 0; i < list.size(); i++) {
            Object v = list.get(i);
            if (v instanceof Number) {
                out[i] = ((Number) v).doubleValue();
            } else {
                errors.add(new ValidationError(field + "[" + i + "]", "must be a number, got " + v));
            }
        }
        return out;
    }
}
