package com.delphine.script.interp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.delphine.script.ast.Expr;
import com.delphine.script.ast.Expr.ExprInterface;
import com.delphine.script.ast.Statement;
import com.delphine.script.ast.Token;
import com.delphine.script.builtins.BuiltinFunction;
import com.delphine.script.host.HostFunctionRegistry;
import com.delphine.script.runtime.ArrayValue;
import com.delphine.script.runtime.EnumValue;
import com.delphine.script.runtime.FunctionPointer;
import com.delphine.script.runtime.InterfaceInstance;
import com.delphine.script.runtime.JsonValues;
import com.delphine.script.runtime.ObjectInstance;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ArrayType;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.ConversionEntry;
import com.delphine.script.types.ConversionRegistry;
import com.delphine.script.types.DataType;
import com.delphine.script.types.EnumType;
import com.delphine.script.types.InterfaceInfo;
import com.delphine.script.types.MethodInfo;
import com.delphine.script.types.Names;
import com.delphine.script.types.RecordType;
import com.delphine.script.types.TypeDeclarationException;

/**
 * Call expressions. Named calls try, in order: a function pointer variable,
 * user functions, methods of the current Self, builtins, host functions and
 * finally a type cast. Member calls dispatch on the receiver's kind.
 */
final class CallDispatcher {

    private final Interpreter interp;

    CallDispatcher(Interpreter interp) {
        this.interp = interp;
    }

    Value call(Expr.Call expr) {
        if (expr.callee instanceof Expr.Identifier) return callNamed((Expr.Identifier) expr.callee, expr);
        if (expr.callee instanceof Expr.Member) return callMember((Expr.Member) expr.callee, expr);

        Value callee = interp.evaluate(expr.callee);
        if (interp.aborted(callee)) return callee;
        return callValue(callee, expr, expr.paren);
    }

    // -------------------------
    // Named calls
    // -------------------------

    private Value callNamed(Expr.Identifier id, Expr.Call expr) {
        String name = id.name.lexeme;
        Token at = id.name;

        Value bound = interp.env.lookup(name);
        if (bound != null) return callValue(bound, expr, at);

        List<UserFunction> overloads = interp.functions.get(Names.normalize(name));
        if (overloads != null && !overloads.isEmpty()) {
            List<Value> args = new ArrayList<>();
            Value failed = interp.evalArgs(expr.arguments, args, expectedForFunctions(overloads, expr.arguments.size()));
            if (failed != null) return failed;
            UserFunction fn = interp.invoker.selectFunction(overloads, args);
            if (fn == null) {
                return interp.error(at, "no overload of " + name + " accepts " + args.size() + " argument(s)");
            }
            return interp.invoker.callFunction(fn, args, expr.arguments, at);
        }

        Value self = interp.env.lookup("Self");
        if (self != null) {
            Value r = trySelfMethod(self.unwrapVariant(), name, expr, at);
            if (r != null) return r;
        }

        BuiltinFunction builtin = interp.builtins.find(name);
        if (builtin != null) {
            List<Value> args = new ArrayList<>();
            Value failed = interp.evalArgs(expr.arguments, args, null);
            if (failed != null) return failed;
            interp.state.currentNode = at;
            return builtin.call(interp, args);
        }

        HostFunctionRegistry.Entry host = interp.hostFunctions.find(name);
        if (host != null) {
            List<Value> args = new ArrayList<>();
            Value failed = interp.evalArgs(expr.arguments, args, null);
            if (failed != null) return failed;
            interp.state.currentNode = at;
            return interp.hostBridge.invoke(host, args);
        }

        DataType castType = interp.types.lookup(name);
        if (castType != null) {
            if (expr.arguments.size() != 1) {
                return interp.error(at, "type cast " + name + " takes exactly one argument");
            }
            Value v = interp.evaluate(expr.arguments.get(0));
            if (interp.aborted(v)) return v;
            return cast(castType, v, at);
        }

        return interp.error(at, "function '" + name + "' not found");
    }

    /** @return the call's result, or null when Self has no routine of that name */
    private Value trySelfMethod(Value self, String name, Expr.Call expr, Token at) {
        switch (self.getType()) {
            case OBJECT: {
                ClassInfo cls = self.asObject().getClassInfo();
                List<MethodInfo> methods = interp.visibleMethods(self.asObject(), name);
                if (!methods.isEmpty()) return invokeMethod(methods, self, cls, expr, at);
                List<MethodInfo> classMethods = cls.findClassMethods(name);
                if (!classMethods.isEmpty()) return invokeMethod(classMethods, Value.classRef(cls), null, expr, at);
                List<MethodInfo> ctors = cls.findConstructors(name);
                if (!ctors.isEmpty()) return invokeMethod(ctors, self, null, expr, at);
                return null;
            }
            case CLASS: {
                ClassInfo cls = self.asClass();
                if (!cls.findClassMethods(name).isEmpty() || !cls.findConstructors(name).isEmpty()) {
                    return callOnClass(cls, name, expr, at);
                }
                return null;
            }
            case RECORD: {
                RecordType rt = self.asRecord().getType();
                List<MethodInfo> methods = rt.findMethods(name);
                if (!methods.isEmpty()) return invokeMethod(methods, self, null, expr, at);
                List<MethodInfo> statics = rt.findStaticMethods(name);
                if (!statics.isEmpty()) return invokeMethod(statics, null, null, expr, at);
                return null;
            }
            default:
                return null;
        }
    }

    // -------------------------
    // Member calls
    // -------------------------

    private Value callMember(Expr.Member member, Expr.Call expr) {
        Token at = member.name;
        String name = member.name.lexeme;

        if (member.target instanceof Expr.Identifier) {
            String typeName = ((Expr.Identifier) member.target).name.lexeme;
            if (!interp.env.exists(typeName)) {
                ClassInfo cls = interp.types.findClass(typeName);
                if (cls != null) return callOnClass(cls, name, expr, at);
                RecordType rt = interp.types.findRecord(typeName);
                if (rt != null) {
                    List<MethodInfo> statics = rt.findStaticMethods(name);
                    if (statics.isEmpty()) {
                        return interp.error(at, "static method " + name + " not found in record " + rt.getName());
                    }
                    return invokeMethod(statics, null, null, expr, at);
                }
            }
        }

        Value owner = interp.evaluate(member.target);
        if (interp.aborted(owner)) return owner;
        Value v = owner.unwrapVariant();

        switch (v.getType()) {
            case NIL:
                if (Names.same(name, "Free")) return Value.nil();
                return interp.error(at, "cannot call method " + name + " on nil value");
            case OBJECT:
                return callOnObject(v, name, expr, at);
            case INTERFACE: {
                InterfaceInstance ii = v.asInterface();
                if (!ii.getInterface().hasMethod(name)) {
                    return interp.error(at, "method " + name + " not found in interface " + ii.getInterface().getName());
                }
                return callOnObject(Value.object(ii.getTarget()), name, expr, at);
            }
            case CLASS:
                return callOnClass(v.asClass(), name, expr, at);
            case RECORD:
                return callOnRecord(v, member.target, name, expr, at);
            case ARRAY:
                return callOnArray(v.asArray(), name, expr, at);
            case SET:
                return callOnSet(v, name, expr, at);
            case STRING:
                if (Names.same(name, "Length") && expr.arguments.isEmpty()) {
                    String s = v.asString();
                    return Value.integer(s.codePointCount(0, s.length()));
                }
                return interp.error(at, "unknown string method " + name);
            default:
                return interp.error(at, "cannot call method " + name + " on type " + v.typeName());
        }
    }

    private Value callOnObject(Value self, String name, Expr.Call expr, Token at) {
        ClassInfo cls = self.asObject().getClassInfo();
        List<MethodInfo> methods = interp.visibleMethods(self.asObject(), name);
        if (!methods.isEmpty()) return invokeMethod(methods, self, cls, expr, at);

        List<MethodInfo> classMethods = cls.findClassMethods(name);
        if (!classMethods.isEmpty()) return invokeMethod(classMethods, Value.classRef(cls), null, expr, at);

        // obj.Create(...) re-runs a constructor on an existing instance
        List<MethodInfo> ctors = cls.findConstructors(name);
        if (!ctors.isEmpty()) return invokeMethod(ctors, self, null, expr, at);

        if (cls.findField(name) != null || cls.findProperty(name) != null) {
            Value member = interp.members.readMember(self, at);
            if (interp.aborted(member)) return member;
            return callValue(member, expr, at);
        }
        return interp.error(at, "method " + name + " not found in class " + cls.getName());
    }

    private Value callOnClass(ClassInfo cls, String name, Expr.Call expr, Token at) {
        List<MethodInfo> ctors = cls.findConstructors(name);
        if (!ctors.isEmpty()) {
            List<Value> args = new ArrayList<>();
            Value failed = interp.evalArgs(expr.arguments, args, expectedForMethods(ctors, expr.arguments.size()));
            if (failed != null) return failed;
            return interp.invoker.construct(cls, name, args, expr.arguments, at);
        }
        List<MethodInfo> classMethods = cls.findClassMethods(name);
        if (!classMethods.isEmpty()) return invokeMethod(classMethods, Value.classRef(cls), null, expr, at);
        return interp.error(at, "method " + name + " not found in class " + cls.getName());
    }

    /**
     * Record methods run on a copy of the receiver, which is then stored back
     * to the receiver's location.
     */
    private Value callOnRecord(Value record, ExprInterface target, String name, Expr.Call expr, Token at) {
        RecordType rt = record.asRecord().getType();
        List<MethodInfo> methods = rt.findMethods(name);
        if (!methods.isEmpty()) {
            Value receiver = record.copyForAssignment();
            Value r = invokeMethod(methods, receiver, null, expr, at);
            if (interp.aborted(r)) return r;
            if (isLocation(target)) {
                Value w = interp.assignTo(target, receiver, at);
                if (interp.aborted(w)) return w;
            }
            return r;
        }
        List<MethodInfo> statics = rt.findStaticMethods(name);
        if (!statics.isEmpty()) return invokeMethod(statics, null, null, expr, at);

        if (rt.findField(name) != null) {
            return callValue(record.asRecord().getField(name), expr, at);
        }
        return interp.error(at, "method " + name + " not found in record " + rt.getName());
    }

    private static boolean isLocation(ExprInterface e) {
        return e instanceof Expr.Identifier || e instanceof Expr.Member || e instanceof Expr.Index;
    }

    private Value callOnArray(ArrayValue arr, String name, Expr.Call expr, Token at) {
        ArrayType type = arr.getType();
        List<Value> args = new ArrayList<>();
        Value failed = interp.evalArgs(expr.arguments, args, Collections.singletonList(type.getElementType()));
        if (failed != null) return failed;

        switch (Names.normalize(name)) {
            case "add":
            case "push": {
                if (args.size() != 1) return arity(at, name, 1, args.size());
                if (type.isStatic()) return interp.error(at, "cannot add to a static array");
                Value c = interp.coercion.coerce(args.get(0), type.getElementType(), at);
                if (interp.aborted(c)) return c;
                arr.add(c.copyForAssignment());
                return Value.nil();
            }
            case "delete": {
                if (args.isEmpty() || args.size() > 2) return arity(at, name, 1, args.size());
                if (type.isStatic()) return interp.error(at, "cannot delete from a static array");
                Value idx = args.get(0).unwrapVariant();
                long count = 1;
                if (args.size() == 2) {
                    Value c = args.get(1).unwrapVariant();
                    if (c.getType() != Value.Type.INTEGER) return interp.error(at, "Delete count must be an Integer");
                    count = c.asInteger();
                }
                if (idx.getType() != Value.Type.INTEGER) {
                    return interp.error(at, "index must be an ordinal value, got " + idx.typeName());
                }
                int p = arr.toPhysical(idx.asInteger());
                if (p < 0) {
                    return interp.error(at, "array index out of bounds: " + idx.asInteger()
                            + " (array length is " + arr.length() + ")");
                }
                for (long i = 0; i < count && p < arr.length(); i++) arr.removeAt(p);
                return Value.nil();
            }
            case "indexof": {
                if (args.size() != 1) return arity(at, name, 1, args.size());
                List<Value> elements = arr.elements();
                for (int i = 0; i < elements.size(); i++) {
                    Value e = elements.get(i);
                    if (e == null) e = interp.zeros.zeroOf(type.getElementType());
                    if (PrimitiveOperators.valuesEqual(e.unwrapVariant(), args.get(0).unwrapVariant())) {
                        return Value.integer(arr.low() + i);
                    }
                }
                return Value.integer(-1);
            }
            case "setlength": {
                if (args.size() != 1) return arity(at, name, 1, args.size());
                if (type.isStatic()) return interp.error(at, "cannot resize a static array");
                Value n = args.get(0).unwrapVariant();
                if (n.getType() != Value.Type.INTEGER || n.asInteger() < 0) {
                    return interp.error(at, "invalid array length " + n.display());
                }
                if (n.asInteger() > ArrayValue.MAX_LENGTH) {
                    return interp.exceptions.raiseNative("ERangeError",
                            "array length " + n.asInteger() + " exceeds " + ArrayValue.MAX_LENGTH, at, null);
                }
                Value zero = interp.zeros.zeroOf(type.getElementType());
                if (zero.isError()) return zero;
                arr.setLength((int) n.asInteger(), zero);
                return Value.nil();
            }
            case "length":
            case "count":
                return Value.integer(arr.length());
            case "high":
                return Value.integer(arr.high());
            case "low":
                return Value.integer(arr.low());
            default:
                return interp.error(at, "unknown array method " + name);
        }
    }

    /** s.Include(x) and s.Exclude(x) share the builtins' checks, with the set as first argument. */
    private Value callOnSet(Value set, String name, Expr.Call expr, Token at) {
        if (!Names.same(name, "Include") && !Names.same(name, "Exclude")) {
            return interp.error(at, "unknown set method " + name);
        }
        List<Value> args = new ArrayList<>();
        args.add(set);
        Value failed = interp.evalArgs(expr.arguments, args, null);
        if (failed != null) return failed;
        BuiltinFunction fn = interp.builtins.find(name);
        if (fn == null) return interp.error(at, "unknown set method " + name);
        interp.state.currentNode = at;
        return fn.call(interp, args);
    }

    private Value arity(Token at, String name, int expected, int got) {
        return interp.error(at, name + " expects " + expected + " argument(s), got " + got);
    }

    // -------------------------
    // Shared
    // -------------------------

    private Value invokeMethod(List<MethodInfo> overloads, Value self, ClassInfo dispatchClass,
                               Expr.Call expr, Token at) {
        List<Value> args = new ArrayList<>();
        Value failed = interp.evalArgs(expr.arguments, args, expectedForMethods(overloads, expr.arguments.size()));
        if (failed != null) return failed;

        MethodInfo m = interp.invoker.selectMethod(overloads, args);
        if (m == null) {
            return interp.error(at, "no overload of " + overloads.get(0).qualifiedName() + " accepts "
                    + args.size() + " argument(s)");
        }
        if (dispatchClass != null) m = dispatchClass.resolveVirtual(m);
        return interp.invoker.callMethod(m, self, args, expr.arguments, at);
    }

    private Value callValue(Value callee, Expr.Call expr, Token at) {
        Value c = callee.unwrapVariant();
        if (c.getType() != Value.Type.FUNCTION_POINTER) {
            return interp.error(at, "value of type " + c.typeName() + " is not callable");
        }
        FunctionPointer fp = c.asFunction();
        List<Value> args = new ArrayList<>();
        Value failed = interp.evalArgs(expr.arguments, args, expectedFor(paramsOf(fp)));
        if (failed != null) return failed;
        return interp.invoker.callPointer(fp, args, expr.arguments, at);
    }

    private static List<Statement.Param> paramsOf(FunctionPointer fp) {
        switch (fp.getKind()) {
            case FUNCTION: return fp.getFunction().params;
            case LAMBDA: return fp.getLambda().params;
            default: return fp.getMethod().isNative() ? null : fp.getMethod().getDecl().params;
        }
    }

    /** Parameter types of the single overload taking argc arguments; null when ambiguous. */
    private List<DataType> expectedForFunctions(List<UserFunction> overloads, int argc) {
        UserFunction only = null;
        for (UserFunction f : overloads) {
            if (!f.accepts(argc)) continue;
            if (only != null) return null;
            only = f;
        }
        return only == null ? null : expectedFor(only.decl.params);
    }

    private List<DataType> expectedForMethods(List<MethodInfo> overloads, int argc) {
        MethodInfo only = null;
        for (MethodInfo m : overloads) {
            if (!m.accepts(argc)) continue;
            if (only != null) return null;
            only = m;
        }
        return (only == null || only.isNative()) ? null : expectedFor(only.getDecl().params);
    }

    private List<DataType> expectedFor(List<Statement.Param> params) {
        if (params == null) return null;
        List<DataType> out = new ArrayList<>(params.size());
        for (Statement.Param p : params) {
            try {
                out.add(interp.resolveType(p.type));
            } catch (TypeDeclarationException e) {
                out.add(null);
            }
        }
        return out;
    }

    // -------------------------
    // Type casts
    // -------------------------

    /**
     * TypeName(x). Registered conversions win; then class downcasts (which
     * raise EInvalidCast), primitive casts, and finally ordinary coercion.
     */
    Value cast(DataType target, Value value, Token at) {
        Value src = value.unwrapVariant();

        ConversionRegistry conversions = interp.types.getConversions();
        String from = ValueTypes.typeKey(src);
        ConversionEntry conv = conversions.findExplicit(from, target.key());
        if (conv == null) conv = conversions.findImplicit(from, target.key());
        if (conv != null && !ValueTypes.sameType(ValueTypes.typeOf(src), target)) {
            return interp.callUserFunction(conv.getBindingName(), Collections.singletonList(src), at);
        }

        switch (target.getKind()) {
            case CLASS: {
                if (src.isNil()) return src;
                ObjectInstance obj = src.objectOrNull();
                if (obj != null && obj.isInstanceOf((ClassInfo) target)) return Value.object(obj);
                return interp.exceptions.raiseNative("EInvalidCast", "invalid class typecast", at, null);
            }
            case INTERFACE:
                return toInterface(src, (InterfaceInfo) target, at);
            case INTEGER:
                switch (src.getType()) {
                    case INTEGER: return src;
                    case FLOAT: return Value.integer((long) src.asFloat());
                    case BOOLEAN: return Value.integer(src.asBool() ? 1 : 0);
                    case ENUM: return Value.integer(src.asEnum().getOrdinal());
                    case STRING:
                        try {
                            return Value.integer(Long.parseLong(src.asString().trim()));
                        } catch (NumberFormatException e) {
                            return interp.exceptions.raiseNative("EConvertError",
                                    "'" + src.asString() + "' is not a valid integer value", at, null);
                        }
                    default: break;
                }
                break;
            case FLOAT:
                if (src.isNumeric()) return Value.floating(src.asNumber());
                if (src.getType() == Value.Type.STRING) {
                    try {
                        return Value.floating(Double.parseDouble(src.asString().trim()));
                    } catch (NumberFormatException e) {
                        return interp.exceptions.raiseNative("EConvertError",
                                "'" + src.asString() + "' is not a valid floating point value", at, null);
                    }
                }
                break;
            case STRING:
                return src.getType() == Value.Type.STRING ? src : Value.string(src.display());
            case BOOLEAN:
                if (src.getType() == Value.Type.BOOLEAN) return src;
                if (src.getType() == Value.Type.INTEGER) return Value.bool(src.asInteger() != 0);
                break;
            case ENUM: {
                EnumType et = (EnumType) target;
                if (src.getType() == Value.Type.INTEGER) {
                    String member = et.nameOf(src.asInteger());
                    if (member == null) {
                        return interp.exceptions.raiseNative("ERangeError",
                                "ordinal " + src.asInteger() + " out of range for " + et.getName(), at, null);
                    }
                    return Value.enumValue(new EnumValue(et, member, src.asInteger()));
                }
                break;
            }
            case VARIANT:
                return Value.variant(src);
            case JSON:
                return Value.json(JsonValues.toJson(src));
            default:
                break;
        }
        return interp.coercion.coerce(src, target, at);
    }

    /** Interface view of an object; EInvalidCast when the class does not implement it. */
    Value toInterface(Value src, InterfaceInfo iface, Token at) {
        if (src.isNil()) return src;
        ObjectInstance obj = src.objectOrNull();
        if (obj != null && obj.getClassInfo().implementsInterface(iface)) {
            return Value.intf(new InterfaceInstance(iface, obj));
        }
        return interp.exceptions.raiseNative("EInvalidCast", "invalid class typecast", at, null);
    }
}
