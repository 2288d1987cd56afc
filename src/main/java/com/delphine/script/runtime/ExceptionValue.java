package com.delphine.script.runtime;

import java.util.Collections;
import java.util.List;

import com.delphine.script.ast.Token;
import com.delphine.script.types.ClassInfo;

/** A raised exception: the object, its class, its message and the call stack at raise time. */
public final class ExceptionValue {

    private final ClassInfo classInfo;
    private final ObjectInstance instance;
    private final String message;
    private final Token position;
    private final List<String> callStack;

    public ExceptionValue(ClassInfo classInfo, ObjectInstance instance, String message,
                          Token position, List<String> callStack) {
        this.classInfo = classInfo;
        this.instance = instance;
        this.message = message == null ? "" : message;
        this.position = position;
        this.callStack = callStack == null ? Collections.emptyList() : Collections.unmodifiableList(callStack);
    }

    public ClassInfo getClassInfo() { return classInfo; }
    public ObjectInstance getInstance() { return instance; }
    public String getMessage() { return message; }
    public Token getPosition() { return position; }

    /** Innermost frame first. */
    public List<String> getCallStack() { return callStack; }

    public String getClassName() {
        return classInfo.getName();
    }

    @Override
    public String toString() {
        return classInfo.getName() + ": " + message;
    }
}
