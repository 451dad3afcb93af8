package ai.mab.ifc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import com.google.common.collect.ImmutableList;

import ai.mab.InvalidParameterException;

/**
 * Settings for a console session. Every key is optional; absent keys keep the
 * defaults below.
 *
 * <pre>
 * articles: 10
 * seed: 42          # null for an unseeded session
 * rounds: 1000
 * trials: 5
 * contextual: false
 * epsilon: 0.1
 * c: 2.0
 * alphaPrior: 1.0
 * betaPrior: 1.0
 * linucb:
 *   alpha: 1.0
 *   regularization: 1.0
 * policies: [epsilon-greedy, ucb, thompson]
 * </pre>
 */
public class SessionConfig {
  public static final String EPSILON_GREEDY = "epsilon-greedy", UCB = "ucb", THOMPSON = "thompson",
      LINUCB = "linucb";
  public static final ImmutableList<String> KNOWN_POLICIES = ImmutableList.of(EPSILON_GREEDY, UCB, THOMPSON, LINUCB);

  public int articles = 10;
  public Long seed = 42L;
  public int rounds = 1000;
  public int trials = 5;
  public boolean contextual = false;
  public double epsilon = .1;
  public double c = 2;
  public double alphaPrior = 1, betaPrior = 1;
  public double linUcbAlpha = 1, linUcbRegularization = 1;
  public List<String> policies = new ArrayList<>(List.of(EPSILON_GREEDY, UCB, THOMPSON));

  public static SessionConfig load(final Path file) throws IOException {
    if (!Files.exists(file)) {
      throw new IOException("Session config not found: " + file);
    }
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    }
  }

  public static SessionConfig load(final InputStream in) {
    final LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    final Object raw = new Yaml(options).load(in);
    if (raw == null) {
      return parse(Map.of());
    }
    InvalidParameterException.check(raw instanceof Map, "session config must be a mapping, got %s",
        raw.getClass().getSimpleName());
    return parse(asMap("session config", raw));
  }

  static SessionConfig parse(final Map<String, Object> raw) {
    final SessionConfig config = new SessionConfig();
    config.articles = getInt(raw, "articles", config.articles);
    if (raw.containsKey("seed")) {
      final Object seed = raw.get("seed");
      config.seed = seed == null ? null : integral("seed", seed);
    }
    config.rounds = getInt(raw, "rounds", config.rounds);
    config.trials = getInt(raw, "trials", config.trials);
    config.contextual = getBoolean(raw, "contextual", config.contextual);
    config.epsilon = getDouble(raw, "epsilon", config.epsilon);
    config.c = getDouble(raw, "c", config.c);
    config.alphaPrior = getDouble(raw, "alphaPrior", config.alphaPrior);
    config.betaPrior = getDouble(raw, "betaPrior", config.betaPrior);

    final Object linUcb = raw.get("linucb");
    if (linUcb != null) {
      InvalidParameterException.check(linUcb instanceof Map, "linucb must be a mapping, got %s", linUcb);
      final Map<String, Object> settings = asMap("linucb", linUcb);
      config.linUcbAlpha = getDouble(settings, "alpha", config.linUcbAlpha);
      config.linUcbRegularization = getDouble(settings, "regularization", config.linUcbRegularization);
    }

    final Object policies = raw.get("policies");
    if (policies != null) {
      InvalidParameterException.check(policies instanceof List, "policies must be a list, got %s", policies);
      config.policies = new ArrayList<>();
      for (final Object policy : (List<?>) policies) {
        InvalidParameterException.check(policy instanceof String, "policy names must be strings, got %s", policy);
        config.policies.add((String) policy);
      }
    }

    config.validate();
    return config;
  }

  public void validate() {
    InvalidParameterException.check(articles > 0, "articles must be positive, got %s", articles);
    InvalidParameterException.check(rounds > 0, "rounds must be positive, got %s", rounds);
    InvalidParameterException.check(trials > 0, "trials must be positive, got %s", trials);
    InvalidParameterException.check(!policies.isEmpty(), "at least one policy is required");
    for (final String policy : policies) {
      InvalidParameterException.check(KNOWN_POLICIES.contains(policy), "unknown policy %s; expected one of %s",
          policy, KNOWN_POLICIES);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(final String key, final Object value) {
    for (final Object entryKey : ((Map<?, ?>) value).keySet()) {
      InvalidParameterException.check(entryKey instanceof String, "%s has non-string key %s", key, entryKey);
    }
    return (Map<String, Object>) value;
  }

  private static long integral(final String key, final Object value) {
    InvalidParameterException.check(value instanceof Integer || value instanceof Long,
        "%s must be an integer, got %s", key, value);
    return ((Number) value).longValue();
  }

  private static int getInt(final Map<String, Object> map, final String key, final int fallback) {
    final Object value = map.get(key);
    if (value == null) {
      return fallback;
    }
    final long integral = integral(key, value);
    InvalidParameterException.check(integral >= Integer.MIN_VALUE && integral <= Integer.MAX_VALUE,
        "%s is out of range: %s", key, integral);
    return (int) integral;
  }

  private static double getDouble(final Map<String, Object> map, final String key, final double fallback) {
    final Object value = map.get(key);
    if (value == null) {
      return fallback;
    }
    InvalidParameterException.check(value instanceof Number, "%s must be a number, got %s", key, value);
    return ((Number) value).doubleValue();
  }

  private static boolean getBoolean(final Map<String, Object> map, final String key, final boolean fallback) {
    final Object value = map.get(key);
    if (value == null) {
      return fallback;
    }
    InvalidParameterException.check(value instanceof Boolean, "%s must be true or false, got %s", key, value);
    return (Boolean) value;
  }

  @Override
  public String toString() {
    return String.format("SessionConfig[articles=%d, seed=%s, rounds=%d, trials=%d, contextual=%s, policies=%s]",
        articles, seed, rounds, trials, contextual, policies);
  }
}
