package com.delphine.script.types;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.delphine.script.ast.Statement;
import com.delphine.script.ast.Statement.Directive;
import com.delphine.script.runtime.Value;

/**
 * A method of a class, record or interface: either a script declaration
 * or a native body supplied by the runtime (TObject, Exception, ...).
 */
public final class MethodInfo {

    /** Body of a runtime-provided method. Self is nil for class methods. */
    public interface NativeMethod {
        Value invoke(Value self, List<Value> args);
    }

    private final String name;
    private final DataType owner;
    private final Statement.FunctionDecl decl;
    private final NativeMethod nativeBody;
    private final int minParams;
    private final int maxParams;
    private final Set<Directive> directives;
    private String slot;

    private MethodInfo(String name, DataType owner, Statement.FunctionDecl decl, NativeMethod nativeBody,
                       int minParams, int maxParams, Set<Directive> directives) {
        this.name = name;
        this.owner = owner;
        this.decl = decl;
        this.nativeBody = nativeBody;
        this.minParams = minParams;
        this.maxParams = maxParams;
        this.directives = directives;
    }

    public static MethodInfo fromDecl(DataType owner, Statement.FunctionDecl decl) {
        int min = 0;
        for (Statement.Param p : decl.params) {
            if (p.defaultValue == null) min++;
        }
        return new MethodInfo(decl.name.lexeme, owner, decl, null, min, decl.params.size(), decl.directives);
    }

    public static MethodInfo nativeMethod(DataType owner, String name, int minParams, int maxParams,
                                          Set<Directive> directives, NativeMethod body) {
        Set<Directive> d = (directives == null || directives.isEmpty())
                ? EnumSet.noneOf(Directive.class) : EnumSet.copyOf(directives);
        return new MethodInfo(name, owner, null, body, minParams, maxParams, d);
    }

    public String getName() { return name; }
    public DataType getOwner() { return owner; }
    public Statement.FunctionDecl getDecl() { return decl; }
    public NativeMethod getNativeBody() { return nativeBody; }
    public int getMinParams() { return minParams; }
    public int getMaxParams() { return maxParams; }

    public boolean isNative() { return nativeBody != null; }
    public boolean isClassMethod() { return directives.contains(Directive.CLASS_METHOD); }
    public boolean isConstructor() { return directives.contains(Directive.CONSTRUCTOR); }
    public boolean isDestructor() { return directives.contains(Directive.DESTRUCTOR); }
    public boolean isVirtual() { return directives.contains(Directive.VIRTUAL); }
    public boolean isOverride() { return directives.contains(Directive.OVERRIDE); }
    public boolean isReintroduce() { return directives.contains(Directive.REINTRODUCE); }
    public boolean isOverload() { return directives.contains(Directive.OVERLOAD); }

    public boolean isAbstract() {
        return directives.contains(Directive.ABSTRACT) || (nativeBody == null && decl != null && decl.body == null);
    }

    public boolean isFunction() {
        return decl != null && decl.returnType != null;
    }

    public boolean accepts(int argCount) {
        return argCount >= minParams && argCount <= maxParams;
    }

    /** Virtual slot key: overloads with different parameter types occupy different slots. */
    public String slotKey() {
        return slot != null ? slot : baseSlotKey();
    }

    String baseSlotKey() {
        return Names.normalize(name) + parameterSignature();
    }

    /** Normalized parameter types, e.g. "(integer,string)". Native methods only know their arity. */
    public String parameterSignature() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < maxParams; i++) {
            if (i > 0) sb.append(',');
            sb.append(decl == null ? "?" : Names.normalize(String.valueOf(decl.params.get(i).type)));
        }
        return sb.append(')').toString();
    }

    void assignSlot(String key) {
        this.slot = key;
    }

    public String qualifiedName() {
        return (owner == null ? "" : owner.getName() + ".") + name;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
