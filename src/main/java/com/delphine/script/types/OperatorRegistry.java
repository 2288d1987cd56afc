package com.delphine.script.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Operator overloads keyed by operator symbol, matched on the exact operand-type tuple. */
public final class OperatorRegistry {

    private final Map<String, List<OperatorEntry>> entries = new LinkedHashMap<>();

    public void register(OperatorEntry entry) {
        if (lookup(entry.getOperator(), entry.getOperandTypes()) != null) {
            throw new TypeDeclarationException("operator already registered: "
                    + entry.getOperator() + " (" + entry.signature() + ")");
        }
        entries.computeIfAbsent(entry.getOperator(), k -> new ArrayList<>()).add(entry);
    }

    /** @return the entry whose operand types equal the given normalized names, or null */
    public OperatorEntry lookup(String operator, List<String> operandTypes) {
        List<OperatorEntry> list = entries.get(Names.normalize(operator));
        if (list == null) return null;
        for (OperatorEntry e : list) {
            if (e.getOperandTypes().equals(operandTypes)) return e;
        }
        return null;
    }

    public List<OperatorEntry> candidates(String operator) {
        List<OperatorEntry> list = entries.get(Names.normalize(operator));
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
