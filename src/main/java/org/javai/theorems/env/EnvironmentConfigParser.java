package org.javai.theorems.env;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InputStream;
import java.io.Reader;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads environment configuration from YAML or JSON text.
 * <p>
 * The document is a mapping from environment id to its settings, optionally
 * wrapped in a top-level {@code environments} key:
 * <pre>
 * environments:
 *   theorem:
 *     display: Theorem
 *     style: plain
 *     reset: section
 *   lemma:
 *     use: theorem
 * </pre>
 * The wrapper is recognised only when the value under {@code environments}
 * is itself a mapping of ids to settings, so an environment may still be
 * called {@code environments}. Recognised keys are {@code name},
 * {@code display}, {@code style},
 * {@code reset} and {@code use}. A {@code reset} of {@code true} means
 * {@code global}; {@code false} or an absent value leaves the environment
 * unnumbered. The parser does not validate references; pass the result to
 * {@link EnvironmentGraph#of(EnvironmentConfig)}.
 */
public class EnvironmentConfigParser {

	private static final String ROOT_KEY = "environments";
	private static final Set<String> KNOWN_KEYS = Set.of("name", "display", "style", "reset", "use");

	private final Yaml yaml = new Yaml();
	private final ObjectMapper objectMapper = new ObjectMapper();

	public EnvironmentConfig parse(InputStream inputStream) {
		try {
			return buildConfig(yaml.load(inputStream));
		} catch (EnvironmentConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new EnvironmentConfigException("Failed to parse environment configuration from input stream", e);
		}
	}

	public EnvironmentConfig parse(Reader reader) {
		try {
			return buildConfig(yaml.load(reader));
		} catch (EnvironmentConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new EnvironmentConfigException("Failed to parse environment configuration from reader", e);
		}
	}

	public EnvironmentConfig parseString(String yamlContent) {
		try {
			return buildConfig(yaml.load(yamlContent));
		} catch (EnvironmentConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new EnvironmentConfigException("Failed to parse environment configuration from string", e);
		}
	}

	public EnvironmentConfig parseJson(String jsonContent) {
		try {
			return buildConfig(objectMapper.readValue(jsonContent, new TypeReference<Map<String, Object>>() {
			}));
		} catch (EnvironmentConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new EnvironmentConfigException("Failed to parse environment configuration from JSON", e);
		}
	}

	@SuppressWarnings("unchecked")
	private EnvironmentConfig buildConfig(Object data) {
		if (data == null) {
			return EnvironmentConfig.builder().build();
		}
		if (!(data instanceof Map<?, ?> root)) {
			throw new EnvironmentConfigException("Environment configuration must be a mapping");
		}
		Map<?, ?> environments = isWrapped(root) ? (Map<?, ?>) root.get(ROOT_KEY) : root;

		EnvironmentConfig.Builder builder = EnvironmentConfig.builder();
		for (Map.Entry<?, ?> entry : environments.entrySet()) {
			String id = String.valueOf(entry.getKey());
			Object settings = entry.getValue();
			if (settings == null) {
				builder.add(EnvironmentSpec.builder(id).build());
				continue;
			}
			if (!(settings instanceof Map<?, ?>)) {
				throw new EnvironmentConfigException("Settings of environment '%s' must be a mapping".formatted(id));
			}
			builder.add(buildSpec(id, (Map<String, Object>) settings));
		}
		return builder.build();
	}

	/**
	 * A lone {@code environments} key is a wrapper only when its value maps ids
	 * to settings; otherwise it is an environment with that id.
	 */
	private boolean isWrapped(Map<?, ?> root) {
		if (root.size() != 1 || !(root.get(ROOT_KEY) instanceof Map<?, ?>)) {
			return false;
		}
		return ((Map<?, ?>) root.get(ROOT_KEY)).values().stream()
				.allMatch(value -> value == null || value instanceof Map<?, ?>);
	}

	private EnvironmentSpec buildSpec(String id, Map<String, Object> settings) {
		for (String key : settings.keySet()) {
			if (!KNOWN_KEYS.contains(key)) {
				throw new EnvironmentConfigException("Unknown key '%s' in environment '%s'".formatted(key, id));
			}
		}
		return EnvironmentSpec.builder(id)
				.renderName(toString(settings.get("name")))
				.displayName(toString(settings.get("display")))
				.style(toString(settings.get("style")))
				.use(toString(settings.get("use")))
				.reset(toReset(settings.get("reset")))
				.build();
	}

	private ResetRule toReset(Object value) {
		if (value instanceof Boolean flag) {
			return flag ? ResetRule.Global.INSTANCE : null;
		}
		return ResetRule.parse(toString(value));
	}

	private String toString(Object obj) {
		if (obj == null) {
			return null;
		}
		return obj instanceof String ? (String) obj : String.valueOf(obj);
	}
}
