package net.littleredcomputer.dpll.tseitin;

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The state of one translation run: the id counter shared by variables and subformulas,
 * the two-way mapping between variable names and ids, the subformula table and the
 * clauses emitted so far. A fresh context is used for every formula, so that several
 * translators can coexist without sharing anything.
 */
public class EncodingContext {
    private static final Logger log = LogManager.getFormatterLogger();
    private final BiMap<String, Integer> variables = HashBiMap.create();
    private final Map<Integer, Subformula> subformulas = new HashMap<>();
    private final List<List<Integer>> clauses = new ArrayList<>();
    private int nextId = 1;

    /**
     * Looks up the variable with the given name, registering it under the next id if it
     * has not been seen before.
     */
    Operand variable(String name) {
        Integer id = variables.get(name);
        if (id == null) {
            id = nextId++;
            variables.put(name, id);
            log.trace("variable %s = %d", name, id);
        }
        return Operand.variable(id);
    }

    /**
     * Records a new subformula node under the next id.
     * @return a reference to the new node
     */
    Operand allocate(Subformula f) {
        for (Operand o : f.operands()) checkRegistered(o);
        int id = nextId++;
        subformulas.put(id, f);
        log.trace("subformula %d = %s", id, f);
        return Operand.subformula(id);
    }

    private void checkRegistered(Operand o) {
        switch (o.kind()) {
            case VARIABLE:
                checkArgument(variables.containsValue(o.id()), "unresolved variable reference %s", o.id());
                break;
            case SUBFORMULA:
                checkArgument(subformulas.containsKey(o.id()), "unresolved subformula reference %s", o.id());
                break;
        }
    }

    public Subformula subformula(int id) {
        Subformula f = subformulas.get(id);
        if (f == null) throw new IllegalArgumentException("unresolved subformula reference " + id);
        return f;
    }

    public Optional<Integer> variableId(String name) { return Optional.ofNullable(variables.get(name)); }

    public Optional<String> variableName(int id) { return Optional.ofNullable(variables.inverse().get(id)); }

    public boolean isSubformula(int id) { return subformulas.containsKey(id); }

    /** @return the number of ids handed out so far, variables and subformulas together */
    public int nIds() { return nextId - 1; }

    public int nVariables() { return variables.size(); }

    void addClause(int... literals) {
        clauses.add(Collections.unmodifiableList(Ints.asList(literals.clone())));
    }

    public List<List<Integer>> clauses() { return Collections.unmodifiableList(clauses); }

    /**
     * Describes every id in order: the name of each variable, the structure of each subformula.
     */
    public List<String> substitutions() {
        ImmutableList.Builder<String> b = ImmutableList.builder();
        for (int id = 1; id < nextId; ++id) {
            Optional<String> name = variableName(id);
            if (name.isPresent()) {
                b.add(id + " = " + name.get());
            } else {
                b.add(id + " = " + subformula(id));
            }
        }
        return b.build();
    }
}
