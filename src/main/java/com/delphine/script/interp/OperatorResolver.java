package com.delphine.script.interp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.delphine.script.ast.Token;
import com.delphine.script.runtime.ObjectInstance;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.DataType;
import com.delphine.script.types.InterfaceInfo;
import com.delphine.script.types.MethodInfo;
import com.delphine.script.types.Names;
import com.delphine.script.types.OperatorEntry;
import com.delphine.script.types.RecordType;

/**
 * Finds and invokes user operator overloads. Order: the left operand's class
 * (walking its ancestors) or record, the right operand's, the global table;
 * exact operand-type tuples first, then tuples the operands are assignable to.
 */
final class OperatorResolver {

    private final Interpreter interp;

    OperatorResolver(Interpreter interp) {
        this.interp = interp;
    }

    /** @return the overload's result, or null when no overload applies */
    Value tryBinary(String op, Value left, Value right, Token at) {
        return tryOperands(op, Arrays.asList(left.unwrapVariant(), right.unwrapVariant()), at);
    }

    Value tryUnary(String op, Value operand, Token at) {
        return tryOperands(op, Collections.singletonList(operand.unwrapVariant()), at);
    }

    private Value tryOperands(String op, List<Value> operands, Token at) {
        OperatorEntry entry = find(op, operands);
        if (entry == null) return null;
        return invoke(entry, operands, at);
    }

    OperatorEntry find(String op, List<Value> operands) {
        List<String> keys = new ArrayList<>(operands.size());
        for (Value v : operands) keys.add(ValueTypes.typeKey(v));

        for (Value v : operands) {
            OperatorEntry e = lookupOwned(v, op, keys);
            if (e != null) return e;
        }
        OperatorEntry global = interp.types.getGlobalOperators().lookup(op, keys);
        if (global != null) return global;

        for (Value v : operands) {
            for (OperatorEntry c : ownedCandidates(v, op)) {
                if (assignable(c, operands)) return c;
            }
        }
        for (OperatorEntry c : interp.types.getGlobalOperators().candidates(op)) {
            if (assignable(c, operands)) return c;
        }
        return null;
    }

    private static OperatorEntry lookupOwned(Value v, String op, List<String> keys) {
        ObjectInstance obj = v.objectOrNull();
        if (obj != null) return obj.getClassInfo().lookupOperator(op, keys);
        if (v.getType() == Value.Type.RECORD) return v.asRecord().getType().lookupOperator(op, keys);
        return null;
    }

    private static List<OperatorEntry> ownedCandidates(Value v, String op) {
        ObjectInstance obj = v.objectOrNull();
        if (obj != null) return obj.getClassInfo().operatorCandidates(op);
        if (v.getType() == Value.Type.RECORD) return v.asRecord().getType().operatorCandidates(op);
        return Collections.emptyList();
    }

    private boolean assignable(OperatorEntry entry, List<Value> operands) {
        List<String> types = entry.getOperandTypes();
        if (types.size() != operands.size()) return false;
        for (int i = 0; i < types.size(); i++) {
            if (!operandMatches(operands.get(i), types.get(i))) return false;
        }
        return true;
    }

    /** Exact key, subclass of the named class, or an object implementing the named interface. */
    private boolean operandMatches(Value v, String typeKey) {
        if (ValueTypes.typeKey(v).equals(typeKey)) return true;
        ObjectInstance obj = v.objectOrNull();
        if (obj == null) {
            return v.getType() == Value.Type.INTEGER && Names.same(typeKey, "float");
        }
        if (obj.getClassInfo().inheritsFromName(typeKey)) return true;
        InterfaceInfo iface = interp.types.findInterface(typeKey);
        return iface != null && obj.getClassInfo().implementsInterface(iface);
    }

    Value invoke(OperatorEntry entry, List<Value> operands, Token at) {
        DataType owner = entry.getOwner();
        if (owner == null) {
            return interp.callUserFunction(entry.getBindingName(), operands, at);
        }

        if (owner instanceof ClassInfo) {
            ClassInfo cls = (ClassInfo) owner;
            if (entry.isClassMethod()) {
                MethodInfo m = interp.invoker.selectMethod(cls.findClassMethods(entry.getBindingName()), operands);
                if (m == null) return missingBinding(entry, at);
                return interp.invoker.callMethod(m, Value.classRef(cls), operands, null, at);
            }
            Value self = operands.get(entry.getSelfIndex());
            ObjectInstance obj = self.objectOrNull();
            if (obj == null || !obj.isInstanceOf(cls)) {
                return interp.error(at, "operator " + entry.getOperator() + " expects a " + cls.getName()
                        + " operand, got " + self.typeName());
            }
            List<Value> args = without(operands, entry.getSelfIndex());
            MethodInfo m = interp.invoker.selectMethod(obj.getClassInfo().findMethods(entry.getBindingName()), args);
            if (m == null) return missingBinding(entry, at);
            return interp.invoker.callMethod(obj.getClassInfo().resolveVirtual(m), Value.object(obj), args, null, at);
        }

        RecordType rt = (RecordType) owner;
        if (entry.isClassMethod()) {
            MethodInfo m = interp.invoker.selectMethod(rt.findStaticMethods(entry.getBindingName()), operands);
            if (m == null) return missingBinding(entry, at);
            return interp.invoker.callMethod(m, null, operands, null, at);
        }
        Value self = operands.get(entry.getSelfIndex());
        if (self.getType() != Value.Type.RECORD) {
            return interp.error(at, "operator " + entry.getOperator() + " expects a " + rt.getName()
                    + " operand, got " + self.typeName());
        }
        List<Value> args = without(operands, entry.getSelfIndex());
        MethodInfo m = interp.invoker.selectMethod(rt.findMethods(entry.getBindingName()), args);
        if (m == null) return missingBinding(entry, at);
        return interp.invoker.callMethod(m, self.copyForAssignment(), args, null, at);
    }

    private Value missingBinding(OperatorEntry entry, Token at) {
        return interp.error(at, "operator " + entry.getOperator() + " is bound to "
                + entry.getBindingName() + ", which accepts no such operands");
    }

    private static List<Value> without(List<Value> operands, int index) {
        List<Value> out = new ArrayList<>(operands);
        if (index >= 0 && index < out.size()) out.remove(index);
        return out;
    }
}
