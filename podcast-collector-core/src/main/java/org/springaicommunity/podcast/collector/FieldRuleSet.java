package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Field rules ordered by priority, highest first.
 *
 * <p>
 * A rule declared later overrides the rules declared before it, so
 * {@code ["**", "!raw.**"]} keeps everything except the raw element graph, and
 * {@code ["!**", "title"]} keeps only the title.
 */
public final class FieldRuleSet {

	private final List<FieldRule> byPriority;

	private FieldRuleSet(List<FieldRule> byPriority) {
		this.byPriority = byPriority;
	}

	/**
	 * Compile rules given in declaration order.
	 * @param rules rule strings, later entries taking precedence
	 * @return the rule set
	 */
	public static FieldRuleSet of(List<String> rules) {
		List<FieldRule> compiled = new ArrayList<>(rules.size());
		for (int i = rules.size() - 1; i >= 0; i--) {
			compiled.add(FieldRule.parse(rules.get(i)));
		}
		return new FieldRuleSet(Collections.unmodifiableList(compiled));
	}

	/**
	 * Find the highest-priority rule matching a key path.
	 * @param keyPath dotted key path
	 * @return the matching rule, or null if none matches
	 */
	@Nullable
	public FieldRule match(String keyPath) {
		for (FieldRule rule : byPriority) {
			if (rule.matches(keyPath)) {
				return rule;
			}
		}
		return null;
	}

	/**
	 * Whether a scalar at the given path is kept.
	 * @param keyPath dotted key path
	 * @return true if the highest-priority matching rule includes it
	 */
	public boolean includes(String keyPath) {
		FieldRule rule = match(keyPath);
		return rule != null && rule.include();
	}

	public List<FieldRule> rules() {
		return byPriority;
	}

}
