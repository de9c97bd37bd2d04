package com.ndcheck.logic;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-logic table of admitted operators, available rules and world discipline.
 * Built once and never mutated afterwards; share {@link #standard()} freely.
 */
public class LogicRegistry {

    private static final LogicRegistry STANDARD = buildStandard();

    private final Map<Logic, Entry> entries = new EnumMap<>(Logic.class);
    private boolean frozen;

    public LogicRegistry register(Entry entry) {
        if (frozen) {
            throw new IllegalStateException("Registry is read-only");
        }
        if (entry != null && entry.getLogic() != null) {
            entries.put(entry.getLogic(), entry);
        }
        return this;
    }

    /**
     * Stop accepting registrations. Lookups are unaffected.
     */
    public LogicRegistry freeze() {
        frozen = true;
        return this;
    }

    public static LogicRegistry standard() {
        return STANDARD;
    }

    public boolean hasLogic(Logic logic) {
        return logic != null && entries.containsKey(logic);
    }

    public Set<Rule> rulesFor(Logic logic) {
        return entry(logic).getRules();
    }

    public Set<Operator> operatorsFor(Logic logic) {
        return entry(logic).getOperators();
    }

    public WorldDiscipline worldDiscipline(Logic logic) {
        return entry(logic).getWorldDiscipline();
    }

    /**
     * Resolve a written rule name for a logic, or null when the name is unknown or the
     * rule is not part of that system.
     */
    public Rule resolveRule(Logic logic, String name) {
        Rule rule = Rule.fromSymbol(name);
        if (rule == null || !rulesFor(logic).contains(rule)) {
            return null;
        }
        return rule;
    }

    public Map<Logic, Entry> all() {
        return Collections.unmodifiableMap(entries);
    }

    private Entry entry(Logic logic) {
        Entry entry = logic != null ? entries.get(logic) : null;
        if (entry == null) {
            throw new IllegalArgumentException("Logic not registered: " + logic);
        }
        return entry;
    }

    /**
     * The rules a system with this language and discipline offers.
     */
    public static EnumSet<Rule> availableRules(Logic logic, WorldDiscipline discipline) {
        EnumSet<Rule> rules = EnumSet.noneOf(Rule.class);
        for (Rule rule : Rule.values()) {
            if (rule.isAvailableIn(logic, discipline)) {
                rules.add(rule);
            }
        }
        return rules;
    }

    private static LogicRegistry buildStandard() {
        LogicRegistry registry = new LogicRegistry();
        for (Logic logic : Logic.values()) {
            EnumSet<Operator> operators = EnumSet.of(
                Operator.SENTENCE_LETTER, Operator.BOTTOM, Operator.NOT,
                Operator.AND, Operator.OR, Operator.IMPLIES, Operator.IFF);
            if (logic.isFirstOrder()) {
                operators.addAll(EnumSet.of(Operator.PREDICATE, Operator.IDENTITY, Operator.FUNCTION,
                    Operator.FORALL, Operator.EXISTS));
            }
            if (logic.isModal()) {
                operators.add(Operator.NECESSARILY);
                operators.add(Operator.POSSIBLY);
            }
            WorldDiscipline discipline = logic.getWorldDiscipline();
            registry.register(new Entry(logic, operators, availableRules(logic, discipline), discipline));
        }
        return registry.freeze();
    }

    /**
     * One row of the registry.
     */
    public static final class Entry {
        private final Logic logic;
        private final Set<Operator> operators;
        private final Set<Rule> rules;
        private final WorldDiscipline worldDiscipline;

        public Entry(Logic logic, Set<Operator> operators, Set<Rule> rules, WorldDiscipline worldDiscipline) {
            this.logic = logic;
            this.operators = Collections.unmodifiableSet(EnumSet.copyOf(operators));
            this.rules = Collections.unmodifiableSet(rules.isEmpty() ? EnumSet.noneOf(Rule.class) : EnumSet.copyOf(rules));
            this.worldDiscipline = worldDiscipline;
        }

        public Logic getLogic() {
            return logic;
        }

        public Set<Operator> getOperators() {
            return operators;
        }

        public Set<Rule> getRules() {
            return rules;
        }

        public WorldDiscipline getWorldDiscipline() {
            return worldDiscipline;
        }
    }
}
