package org.springaicommunity.podcast.collector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Produces a filtered copy of an object graph according to {@link FieldRuleSet} rules.
 *
 * <p>
 * Scalars are kept when the highest-priority rule matching their full dotted path
 * includes them. Nested objects and lists are kept only if something inside them
 * survives. List elements share the path of the list itself. The keys {@code $}
 * (element attributes) and {@code _} (element text) of raw feed graphs are structural and
 * always copied unfiltered.
 */
public class FieldProjector {

	/**
	 * Key holding the attributes of a raw XML element.
	 */
	public static final String ATTRIBUTES_KEY = "$";

	/**
	 * Key holding the text content of a raw XML element.
	 */
	public static final String TEXT_KEY = "_";

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	private final ObjectMapper objectMapper;

	public FieldProjector(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Project a domain object.
	 * @param source any object Jackson can convert into a map
	 * @param rules rule strings in declaration order
	 * @return the filtered copy
	 */
	public Map<String, Object> project(Object source, List<String> rules) {
		Map<String, Object> graph = objectMapper.convertValue(source, MAP_TYPE);
		return project(graph, FieldRuleSet.of(rules));
	}

	/**
	 * Project a map graph.
	 * @param graph maps, lists and scalars
	 * @param rules compiled rules
	 * @return the filtered copy
	 */
	public Map<String, Object> project(Map<String, ?> graph, FieldRuleSet rules) {
		return projectObject(graph, rules, "");
	}

	private Map<String, Object> projectObject(Map<?, ?> object, FieldRuleSet rules, String prefix) {
		Map<String, Object> result = new LinkedHashMap<>();
		for (Map.Entry<?, ?> field : object.entrySet()) {
			String key = String.valueOf(field.getKey());
			Object value = field.getValue();
			if (ATTRIBUTES_KEY.equals(key) || TEXT_KEY.equals(key)) {
				result.put(key, value);
				continue;
			}
			projectValue(value, rules, prefix + key).ifPresent(projected -> result.put(key, unwrap(projected)));
		}
		return result;
	}

	// Optional.empty() means "drop"; a present Optional wrapping NullValue keeps an explicit null.
	private Optional<Object> projectValue(Object value, FieldRuleSet rules, String fullKey) {
		if (value instanceof List<?> list) {
			List<Object> nested = new ArrayList<>();
			for (Object item : list) {
				projectValue(item, rules, fullKey).ifPresent(projected -> nested.add(unwrap(projected)));
			}
			return nested.isEmpty() ? Optional.empty() : Optional.of(nested);
		}
		if (value instanceof Map<?, ?> map) {
			Map<String, Object> nested = projectObject(map, rules, fullKey + ".");
			return nested.isEmpty() ? Optional.empty() : Optional.of(nested);
		}
		if (rules.includes(fullKey)) {
			return Optional.of(value == null ? NullValue.INSTANCE : value);
		}
		return Optional.empty();
	}

	private static Object unwrap(Object value) {
		return value == NullValue.INSTANCE ? null : value;
	}

	private enum NullValue {

		INSTANCE

	}

}
