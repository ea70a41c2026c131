package sgg.grammars;

import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Writes the rule table as grammar text.
 * <p>
 * Rules are emitted major section by major section, each followed depth-first
 * by the rules its productions reference, so related rules stay close
 * together. Major sections are never entered from another rule; this keeps,
 * for example, expressions from showing up in the middle of the member
 * declarations. All rules not reached that way follow in alphabetical order.
 */
public class GrammarEmitter {

	private static final Logger log = Logger.getLogger(GrammarEmitter.class.getName());

	public static final String AUTO_GENERATED_COMMENT = "// <auto-generated />";

	private final GrammarConfiguration config;
	private final RuleTable rules;
	private final ImmutableBiMap<String, String> normalizedNames;
	private final ImmutableSet<String> majorSections;

	public GrammarEmitter(GrammarConfiguration config, RuleTable rules, NameNormalizer normalizer) {
		this.config = config;
		this.rules = rules;
		this.normalizedNames = normalizer.normalizeAll(rules.ruleNames());
		this.majorSections = ImmutableSet.copyOf(config.getMajorSections());
	}

	public String emit() {
		Set<String> seen = Sets.newHashSet();
		List<Rule> normalizedRules = Lists.newArrayList();

		for (String section : majorSections) {
			if (rules.contains(section)) {
				addNormalizedRules(section, seen, normalizedRules);
			} else {
				log.fine(() -> "Major section " + section + " is not part of the schema");
			}
		}

		// everything not reached from a major section
		for (String name : rules.sortedRuleNames()) {
			addNormalizedRules(name, seen, normalizedRules);
		}

		StringBuilder sb = new StringBuilder();
		sb.append(AUTO_GENERATED_COMMENT + "\n");
		sb.append("grammar " + config.getGrammarName() + ";");
		for (Rule r : normalizedRules) {
			translateRule(sb, r);
		}
		return sb.toString();
	}

	private void addNormalizedRules(String name, Set<String> seen, List<Rule> normalizedRules) {
		if (!seen.add(name)) {
			return;
		}
		ImmutableList<Production> sorted = rules.sortedProductions(name);
		if (sorted.isEmpty()) {
			log.fine(() -> "Skipping rule without productions: " + name);
		} else {
			ImmutableList.Builder<String> texts = ImmutableList.builder();
			for (Production p : sorted) {
				texts.add(p.getText());
			}
			normalizedRules.add(new Rule(normalizedNames.get(name), texts.build()));
		}

		Set<String> references = Sets.newLinkedHashSet();
		for (Production p : sorted) {
			for (String ref : p.getRuleReferences()) {
				if (!majorSections.contains(ref)) {
					references.add(ref);
				}
			}
		}
		for (String ref : references) {
			addNormalizedRules(ref, seen, normalizedRules);
		}
	}

	private static void translateRule(StringBuilder sb, Rule r) {
		if (r.productions.isEmpty()) {
			throw GrammarGenerationException.emptyRule(r.name);
		}
		sb.append("\n\n");
		sb.append(r.name);
		sb.append("\n  : ");
		Joiner.on("\n  | ").appendTo(sb, r.productions);
		sb.append("\n  ;");
	}

	private static final class Rule {
		final String name;
		final ImmutableList<String> productions;

		Rule(String name, ImmutableList<String> productions) {
			this.name = name;
			this.productions = productions;
		}
	}

}
