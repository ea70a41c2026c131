package sgg.grammars;

import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * The productions of every rule, keyed by the raw (not normalized) rule name.
 * Adding a production a rule already has is a no-op.
 */
public class RuleTable {

    private final Map<String, Set<Production>> rules = Maps.newLinkedHashMap();

    /**
     * Makes {@code name} a rule, initially without productions.
     */
    public void declare(String name) {
        rules.computeIfAbsent(name, k -> Sets.newLinkedHashSet());
    }

    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    public void add(String name, Production production) {
        productionsOf(name).add(production);
    }

    public void addAll(String name, Collection<Production> productions) {
        productionsOf(name).addAll(productions);
    }

    /**
     * Adds a rule with a single production unless a rule with that name
     * already exists.
     *
     * @return whether the rule was added
     */
    public boolean addPlaceholder(String name, Production production) {
        if (rules.containsKey(name)) {
            return false;
        }
        declare(name);
        add(name, production);
        return true;
    }

    /**
     * The productions of a rule ordered by their text.
     */
    public ImmutableList<Production> sortedProductions(String name) {
        return ImmutableList.sortedCopyOf(Comparator.comparing(Production::getText), productionsOf(name));
    }

    public ImmutableSortedSet<String> sortedRuleNames() {
        return ImmutableSortedSet.copyOf(rules.keySet());
    }

    public Set<String> ruleNames() {
        return rules.keySet();
    }

    public int size() {
        return rules.size();
    }

    /**
     * Checks that every referenced rule exists and has at least one
     * production.
     */
    public void checkReferences() {
        for (Map.Entry<String, Set<Production>> e : rules.entrySet()) {
            for (Production p : e.getValue()) {
                for (String ref : p.getRuleReferences()) {
                    Set<Production> target = rules.get(ref);
                    if (target == null) {
                        throw GrammarGenerationException.unresolvedRule(ref);
                    }
                    if (target.isEmpty()) {
                        throw GrammarGenerationException.emptyRule(ref);
                    }
                }
            }
        }
    }

    private Set<Production> productionsOf(String name) {
        Set<Production> result = rules.get(name);
        if (result == null) {
            throw GrammarGenerationException.unresolvedRule(name);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String name : rules.keySet()) {
            sb.append(name).append(" = ").append(sortedProductions(name)).append("\n");
        }
        return sb.toString();
    }
}
