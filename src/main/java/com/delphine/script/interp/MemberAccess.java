package com.delphine.script.interp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.delphine.script.ast.Expr;
import com.delphine.script.ast.Token;
import com.delphine.script.runtime.EnumValue;
import com.delphine.script.runtime.JsonValues;
import com.delphine.script.runtime.ObjectInstance;
import com.delphine.script.runtime.RecordValue;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.EnumType;
import com.delphine.script.types.FieldInfo;
import com.delphine.script.types.MethodInfo;
import com.delphine.script.types.Names;
import com.delphine.script.types.PropertyInfo;
import com.delphine.script.types.RecordType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Reads and writes of target.Name, including properties and type-qualified members. */
final class MemberAccess {

    private final Interpreter interp;

    MemberAccess(Interpreter interp) {
        this.interp = interp;
    }

    // -------------------------
    // Reads
    // -------------------------

    Value read(Expr.Member expr) {
        Value typeMember = readTypeQualified(expr);
        if (typeMember != null) return typeMember;

        Value owner = interp.evaluate(expr.target);
        if (interp.aborted(owner)) return owner;
        return readMember(owner, expr.name);
    }

    /** TEnum.Member, TClass.ClassVar, TClass.Create and other members named through a type; null otherwise. */
    private Value readTypeQualified(Expr.Member expr) {
        if (!(expr.target instanceof Expr.Identifier)) return null;
        String typeName = ((Expr.Identifier) expr.target).name.lexeme;
        if (interp.env.exists(typeName)) return null;

        for (EnumType et : interp.types.getEnums()) {
            if (Names.same(et.getName(), typeName) && et.hasMember(expr.name.lexeme)) {
                String member = expr.name.lexeme;
                long ordinal = et.ordinalOf(member);
                return Value.enumValue(new EnumValue(et, et.nameOf(ordinal), ordinal));
            }
        }
        ClassInfo cls = interp.types.findClass(typeName);
        if (cls != null) return readMember(Value.classRef(cls), expr.name);

        RecordType rt = interp.types.findRecord(typeName);
        if (rt != null) {
            MethodInfo m = interp.invoker.selectMethod(rt.findStaticMethods(expr.name.lexeme), Collections.emptyList());
            if (m != null) return interp.invoker.callMethod(m, null, Collections.emptyList(), null, expr.name);
            return interp.error(expr.name, "member " + expr.name.lexeme + " not found in record " + rt.getName());
        }
        return null;
    }

    Value readMember(Value owner, Token name) {
        Value v = owner.unwrapVariant();
        if (v.isNil()) {
            // Free is nil-safe
            if (is(name.lexeme, "Free")) return Value.nil();
            return interp.error(name, "cannot access member " + name.lexeme + " of nil value");
        }
        Value found = tryReadMember(v, name);
        if (found != null) return found;

        switch (v.getType()) {
            case OBJECT:
                return interp.error(name, "member " + name.lexeme + " not found in class " + v.typeName());
            case INTERFACE:
                return interp.error(name, "member " + name.lexeme + " not found in interface " + v.typeName());
            case RECORD:
                return interp.error(name, "member " + name.lexeme + " not found in record " + v.typeName());
            case CLASS:
                return interp.error(name, "member " + name.lexeme + " not found in class " + v.asClass().getName());
            default:
                return interp.error(name, "cannot access member " + name.lexeme + " of type " + v.typeName());
        }
    }

    /** @return the member's value, or null when the owner has no such member */
    Value tryReadMember(Value owner, Token name) {
        String n = name.lexeme;
        switch (owner.getType()) {
            case OBJECT: {
                ObjectInstance obj = owner.asObject();
                ClassInfo cls = obj.getClassInfo();
                if (cls.findField(n) != null) return obj.getField(n);
                PropertyInfo p = cls.findProperty(n);
                if (p != null) return readProperty(owner, p, Collections.emptyList(), name);
                List<MethodInfo> methods = interp.visibleMethods(obj, n);
                if (!methods.isEmpty()) return callNoArgs(methods, owner, cls, name);
                ClassInfo varOwner = cls.findClassVarOwner(n);
                if (varOwner != null) return varOwner.getClassVarValue(n);
                List<MethodInfo> classMethods = cls.findClassMethods(n);
                if (!classMethods.isEmpty()) return callNoArgs(classMethods, Value.classRef(cls), null, name);
                return null;
            }
            case INTERFACE: {
                ObjectInstance target = owner.asInterface().getTarget();
                PropertyInfo p = owner.asInterface().getInterface().findProperty(n);
                if (p != null) return readProperty(Value.object(target), p, Collections.emptyList(), name);
                if (owner.asInterface().getInterface().hasMethod(n)) {
                    return callNoArgs(target.getClassInfo().findMethods(n), Value.object(target), target.getClassInfo(), name);
                }
                return null;
            }
            case CLASS: {
                ClassInfo cls = owner.asClass();
                ClassInfo varOwner = cls.findClassVarOwner(n);
                if (varOwner != null) return varOwner.getClassVarValue(n);
                List<MethodInfo> classMethods = cls.findClassMethods(n);
                if (!classMethods.isEmpty()) return callNoArgs(classMethods, owner, null, name);
                if (!cls.findConstructors(n).isEmpty()) {
                    return interp.invoker.construct(cls, n, Collections.emptyList(), null, name);
                }
                return null;
            }
            case RECORD: {
                RecordValue rec = owner.asRecord();
                RecordType rt = rec.getType();
                if (rt.findField(n) != null) return rec.getField(n);
                PropertyInfo p = rt.findProperty(n);
                if (p != null) return readProperty(owner, p, Collections.emptyList(), name);
                if (!rt.findMethods(n).isEmpty()) return callNoArgs(rt.findMethods(n), owner.copyForAssignment(), null, name);
                if (!rt.findStaticMethods(n).isEmpty()) return callNoArgs(rt.findStaticMethods(n), null, null, name);
                return null;
            }
            case ARRAY:
                if (is(n, "Length") || is(n, "Count")) return Value.integer(owner.asArray().length());
                if (is(n, "High")) return Value.integer(owner.asArray().high());
                if (is(n, "Low")) return Value.integer(owner.asArray().low());
                return null;
            case STRING:
                if (is(n, "Length")) {
                    String s = owner.asString();
                    return Value.integer(s.codePointCount(0, s.length()));
                }
                return null;
            case JSON: {
                JsonNode node = owner.asJson();
                if (node.isObject()) return JsonValues.toValue(node.get(n));
                if (node.isArray() && (is(n, "Length") || is(n, "Count"))) return Value.integer(node.size());
                return null;
            }
            default:
                return null;
        }
    }

    private Value callNoArgs(List<MethodInfo> overloads, Value self, ClassInfo dispatchClass, Token at) {
        MethodInfo m = interp.invoker.selectMethod(overloads, Collections.emptyList());
        if (m == null) {
            return interp.error(at, "method " + overloads.get(0).qualifiedName() + " requires arguments");
        }
        if (dispatchClass != null) m = dispatchClass.resolveVirtual(m);
        return interp.invoker.callMethod(m, self, Collections.emptyList(), null, at);
    }

    private static boolean is(String a, String b) {
        return Names.same(a, b);
    }

    // -------------------------
    // Writes
    // -------------------------

    Value write(Expr.Member target, Value value, Token at) {
        if (target.target instanceof Expr.Identifier) {
            String typeName = ((Expr.Identifier) target.target).name.lexeme;
            ClassInfo cls = interp.env.exists(typeName) ? null : interp.types.findClass(typeName);
            if (cls != null) return writeMember(Value.classRef(cls), target.name, value, at);
        }
        Value owner = interp.evaluate(target.target);
        if (interp.aborted(owner)) return owner;
        return writeMember(owner, target.name, value, at);
    }

    Value writeMember(Value owner, Token name, Value value, Token at) {
        Value v = owner.unwrapVariant();
        if (v.isNil()) {
            return interp.error(name, "cannot access member " + name.lexeme + " of nil value");
        }
        Value done = tryWriteMember(v, name, value, at);
        if (done != null) return done;
        return interp.error(name, "cannot assign to member " + name.lexeme + " of type " + v.typeName());
    }

    /** @return nil (or an error) when written, null when the owner has no such writable member */
    Value tryWriteMember(Value owner, Token name, Value value, Token at) {
        String n = name.lexeme;
        switch (owner.getType()) {
            case OBJECT: {
                ObjectInstance obj = owner.asObject();
                ClassInfo cls = obj.getClassInfo();
                FieldInfo f = cls.findField(n);
                if (f != null) {
                    Value c = interp.coercion.coerce(value, f.getType(), at);
                    if (interp.aborted(c)) return c;
                    obj.setField(n, c.copyForAssignment());
                    return Value.nil();
                }
                PropertyInfo p = cls.findProperty(n);
                if (p != null) return writeProperty(owner, p, Collections.emptyList(), value, at);
                return writeClassVar(cls, n, value, at);
            }
            case INTERFACE: {
                PropertyInfo p = owner.asInterface().getInterface().findProperty(n);
                if (p == null) return null;
                return writeProperty(Value.object(owner.asInterface().getTarget()), p, Collections.emptyList(), value, at);
            }
            case CLASS:
                return writeClassVar(owner.asClass(), n, value, at);
            case RECORD: {
                RecordValue rec = owner.asRecord();
                FieldInfo f = rec.getType().findField(n);
                if (f != null) {
                    Value c = interp.coercion.coerce(value, f.getType(), at);
                    if (interp.aborted(c)) return c;
                    rec.setField(n, c.copyForAssignment());
                    return Value.nil();
                }
                PropertyInfo p = rec.getType().findProperty(n);
                if (p != null) return writeProperty(owner, p, Collections.emptyList(), value, at);
                return null;
            }
            case JSON: {
                JsonNode node = owner.asJson();
                if (!node.isObject()) return null;
                ((ObjectNode) node).set(n, JsonValues.toJson(value));
                return Value.nil();
            }
            default:
                return null;
        }
    }

    private Value writeClassVar(ClassInfo cls, String n, Value value, Token at) {
        ClassInfo varOwner = cls.findClassVarOwner(n);
        if (varOwner == null) return null;
        Value c = interp.coercion.coerce(value, varOwner.getClassVar(n).getType(), at);
        if (interp.aborted(c)) return c;
        varOwner.setClassVarValue(n, c.copyForAssignment());
        return Value.nil();
    }

    // -------------------------
    // Properties
    // -------------------------

    /** Named property on an object, interface or record value, or null. */
    PropertyInfo findProperty(Value owner, String name) {
        switch (owner.getType()) {
            case OBJECT: return owner.asObject().getClassInfo().findProperty(name);
            case INTERFACE: return owner.asInterface().getInterface().findProperty(name);
            case RECORD: return owner.asRecord().getType().findProperty(name);
            default: return null;
        }
    }

    PropertyInfo defaultProperty(Value owner) {
        switch (owner.getType()) {
            case OBJECT: return owner.asObject().getClassInfo().getDefaultProperty();
            case INTERFACE: return owner.asInterface().getInterface().getDefaultProperty();
            case RECORD: return owner.asRecord().getType().getDefaultProperty();
            default: return null;
        }
    }

    /** Field-backed reads return the field; method-backed reads call the getter with the indices. */
    Value readProperty(Value owner, PropertyInfo p, List<Value> indices, Token at) {
        if (!p.isReadable()) {
            return interp.error(at, "property " + p.getName() + " is write-only");
        }
        Value self = receiverOf(owner);
        String spec = p.getReadSpec();

        if (indices.isEmpty()) {
            Value field = readAccessorField(self, spec);
            if (field != null) return field;
        }
        List<MethodInfo> getters = accessorMethods(self, spec);
        MethodInfo getter = interp.invoker.selectMethod(getters, indices);
        if (getter == null) {
            return interp.error(at, "property " + p.getName() + " has no read accessor " + spec
                    + " taking " + indices.size() + " index argument(s)");
        }
        return interp.invoker.callMethod(dispatch(self, getter), self, indices, null, at);
    }

    Value writeProperty(Value owner, PropertyInfo p, List<Value> indices, Value value, Token at) {
        if (!p.isWritable()) {
            return interp.error(at, "property " + p.getName() + " is read-only");
        }
        Value coerced = interp.coercion.coerce(value, p.getType(), at);
        if (interp.aborted(coerced)) return coerced;

        Value self = receiverOf(owner);
        String spec = p.getWriteSpec();

        if (indices.isEmpty() && writeAccessorField(self, spec, coerced)) {
            return Value.nil();
        }
        List<Value> args = new ArrayList<>(indices);
        args.add(coerced);
        MethodInfo setter = interp.invoker.selectMethod(accessorMethods(self, spec), args);
        if (setter == null) {
            return interp.error(at, "property " + p.getName() + " has no write accessor " + spec
                    + " taking " + args.size() + " argument(s)");
        }
        Value r = interp.invoker.callMethod(dispatch(self, setter), self, args, null, at);
        return interp.aborted(r) ? r : Value.nil();
    }

    private static Value receiverOf(Value owner) {
        if (owner.getType() == Value.Type.INTERFACE) return Value.object(owner.asInterface().getTarget());
        return owner;
    }

    private static Value readAccessorField(Value self, String spec) {
        if (self.getType() == Value.Type.OBJECT && self.asObject().getClassInfo().findField(spec) != null) {
            return self.asObject().getField(spec);
        }
        if (self.getType() == Value.Type.RECORD && self.asRecord().getType().findField(spec) != null) {
            return self.asRecord().getField(spec);
        }
        return null;
    }

    private static boolean writeAccessorField(Value self, String spec, Value value) {
        if (self.getType() == Value.Type.OBJECT && self.asObject().getClassInfo().findField(spec) != null) {
            self.asObject().setField(spec, value.copyForAssignment());
            return true;
        }
        if (self.getType() == Value.Type.RECORD && self.asRecord().getType().findField(spec) != null) {
            self.asRecord().setField(spec, value.copyForAssignment());
            return true;
        }
        return false;
    }

    private static List<MethodInfo> accessorMethods(Value self, String spec) {
        if (self.getType() == Value.Type.OBJECT) return self.asObject().getClassInfo().findMethods(spec);
        if (self.getType() == Value.Type.RECORD) return self.asRecord().getType().findMethods(spec);
        return Collections.emptyList();
    }

    private static MethodInfo dispatch(Value self, MethodInfo m) {
        if (self.getType() == Value.Type.OBJECT) return self.asObject().getClassInfo().resolveVirtual(m);
        return m;
    }
}
