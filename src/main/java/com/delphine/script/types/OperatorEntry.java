package com.delphine.script.types;

import java.util.Collections;
import java.util.List;

/**
 * One operator overload. selfIndex is the operand that becomes Self for an
 * instance-method binding, -1 for class-method and global bindings.
 */
public final class OperatorEntry {

    private final String operator;
    private final List<String> operandTypes;
    private final String bindingName;
    private final int selfIndex;
    private final boolean classMethod;
    private final DataType owner;

    public OperatorEntry(String operator, List<String> operandTypes, String bindingName,
                         int selfIndex, boolean classMethod, DataType owner) {
        this.operator = Names.normalize(operator);
        this.operandTypes = Collections.unmodifiableList(operandTypes);
        this.bindingName = bindingName;
        this.selfIndex = selfIndex;
        this.classMethod = classMethod;
        this.owner = owner;
    }

    public String getOperator() { return operator; }
    public List<String> getOperandTypes() { return operandTypes; }
    public String getBindingName() { return bindingName; }
    public int getSelfIndex() { return selfIndex; }
    public boolean isClassMethod() { return classMethod; }

    /** Declaring class or record; null for global operators. */
    public DataType getOwner() { return owner; }

    public String signature() {
        return String.join("|", operandTypes);
    }

    @Override
    public String toString() {
        return operator + "(" + signature() + ") -> " + bindingName;
    }
}
