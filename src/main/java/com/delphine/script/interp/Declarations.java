package com.delphine.script.interp;

import java.util.ArrayList;
import java.util.List;

import com.delphine.debug.Debug;
import com.delphine.script.ast.Statement;
import com.delphine.script.ast.Token;
import com.delphine.script.ast.TypeRef;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.ConversionEntry;
import com.delphine.script.types.DataType;
import com.delphine.script.types.EnumType;
import com.delphine.script.types.FieldInfo;
import com.delphine.script.types.InterfaceInfo;
import com.delphine.script.types.MethodInfo;
import com.delphine.script.types.Names;
import com.delphine.script.types.OperatorEntry;
import com.delphine.script.types.PrimitiveType;
import com.delphine.script.types.PropertyInfo;
import com.delphine.script.types.RecordType;
import com.delphine.script.types.TypeDeclarationException;

/**
 * Turns type, routine and operator declarations into registry metadata.
 * Declaration problems surface as ERROR values at the declaring node.
 */
final class Declarations {

    private static final String TAG = "Types";

    private final Interpreter interp;

    Declarations(Interpreter interp) {
        this.interp = interp;
    }

    // -------------------------
    // Routines
    // -------------------------

    Value declareFunction(Statement.FunctionDecl decl) {
        List<UserFunction> overloads = interp.functions.computeIfAbsent(Names.normalize(decl.name.lexeme),
                k -> new ArrayList<>());
        for (UserFunction existing : overloads) {
            if (sameSignature(existing.decl.params, decl.params)) {
                return interp.error(decl.name, "function " + decl.name.lexeme
                        + " already declared with the same parameter list");
            }
        }
        overloads.add(new UserFunction(decl, interp.env));
        return Value.nil();
    }

    private static boolean sameSignature(List<Statement.Param> a, List<Statement.Param> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (!Names.same(String.valueOf(a.get(i).type), String.valueOf(b.get(i).type))) return false;
        }
        return true;
    }

    // -------------------------
    // Classes
    // -------------------------

    Value declareClass(Statement.ClassDecl decl) {
        try {
            ClassInfo parent;
            if (decl.parent != null) {
                parent = interp.types.findClass(decl.parent.lexeme);
                if (parent == null) {
                    throw new TypeDeclarationException("unknown parent class " + decl.parent.lexeme);
                }
            } else {
                parent = interp.types.findClass("TObject");
            }

            ClassInfo cls = new ClassInfo(decl.name.lexeme, parent, decl.isAbstract);
            // registered first so fields and methods may refer to the class itself
            interp.types.registerClass(cls);

            for (Token name : decl.interfaces) {
                InterfaceInfo iface = interp.types.findInterface(name.lexeme);
                if (iface == null) throw new TypeDeclarationException("unknown interface " + name.lexeme);
                cls.addInterface(iface);
            }

            for (Statement.FieldDecl f : decl.fields) {
                DataType type = fieldType(f);
                FieldInfo field = new FieldInfo(f.name.lexeme, type, f.initializer, cls.getName());
                if (f.classVar) {
                    Value initial = classVarInitial(field, f.name);
                    if (interp.aborted(initial)) return initial;
                    cls.addClassVar(field, initial);
                } else {
                    cls.addField(field);
                }
            }

            for (Statement.FunctionDecl m : decl.methods) {
                cls.addMethod(MethodInfo.fromDecl(cls, m));
            }

            for (Statement.PropertyDecl p : decl.properties) {
                PropertyInfo prop = property(p);
                checkAccessor(p, p.readSpec, cls.findField(p.readSpec) != null || cls.hasMethodNamed(p.readSpec));
                checkAccessor(p, p.writeSpec, cls.findField(p.writeSpec) != null || cls.hasMethodNamed(p.writeSpec));
                cls.addProperty(prop);
            }

            for (Statement.OperatorDecl op : decl.operators) {
                registerClassOperator(cls, op);
            }

            for (InterfaceInfo iface : cls.getInterfaces()) {
                for (MethodInfo required : iface.allMethods().values()) {
                    if (!cls.hasMethodNamed(required.getName())) {
                        throw new TypeDeclarationException("class " + cls.getName() + " does not implement interface "
                                + iface.getName() + " (missing method " + required.getName() + ")");
                    }
                }
            }

            cls.buildVirtualMethodTable();
            return Value.nil();
        } catch (TypeDeclarationException e) {
            return interp.error(decl.name, e.getMessage());
        }
    }

    private DataType fieldType(Statement.FieldDecl f) {
        if (f.type != null) return interp.resolveType(f.type);
        if (f.initializer == null) {
            throw new TypeDeclarationException("field " + f.name.lexeme + " needs a type or an initializer");
        }
        // typed by whatever the initializer produces
        return PrimitiveType.UNKNOWN;
    }

    private Value classVarInitial(FieldInfo field, Token at) {
        if (field.getInitializer() == null) return interp.zeros.zeroOf(field.getType());
        Value v = interp.evaluateWithExpected(field.getInitializer(), field.getType());
        if (interp.aborted(v)) return v;
        return interp.coercion.coerce(v, field.getType(), at).copyForAssignment();
    }

    private PropertyInfo property(Statement.PropertyDecl p) {
        List<DataType> indexTypes = new ArrayList<>();
        for (Statement.Param ip : p.indexParams) indexTypes.add(interp.resolveType(ip.type));
        return new PropertyInfo(p.name.lexeme, interp.resolveType(p.type), indexTypes,
                p.readSpec, p.writeSpec, p.isDefault);
    }

    private static void checkAccessor(Statement.PropertyDecl p, String spec, boolean exists) {
        if (spec != null && !exists) {
            throw new TypeDeclarationException("property " + p.name.lexeme + " accessor " + spec + " not found");
        }
    }

    /**
     * The owning type is prepended to the operand types when absent (appended
     * for 'in'); instance bindings record where Self sits in the tuple.
     */
    private void registerClassOperator(ClassInfo cls, Statement.OperatorDecl op) {
        String binding = op.binding.lexeme;
        boolean classMethod;
        if (!cls.findClassMethods(binding).isEmpty()) {
            classMethod = true;
        } else if (!cls.findMethods(binding).isEmpty()) {
            classMethod = false;
        } else {
            throw new TypeDeclarationException("class operator '" + op.operator.lexeme + "' uses unknown method "
                    + binding + " of class " + cls.getName());
        }

        List<String> operandTypes = operandKeys(op.operandTypes);
        int selfIndex = withOwner(operandTypes, cls.key(), op.operator.lexeme);
        OperatorEntry entry = new OperatorEntry(op.operator.lexeme, operandTypes, binding,
                classMethod ? -1 : selfIndex, classMethod, cls);
        cls.registerOperator(entry);
        Debug.get().d(TAG, "class operator " + entry + " on " + cls.getName());
    }

    private void registerRecordOperator(RecordType rt, Statement.OperatorDecl op) {
        String binding = op.binding.lexeme;
        boolean classMethod;
        if (!rt.findStaticMethods(binding).isEmpty()) {
            classMethod = true;
        } else if (!rt.findMethods(binding).isEmpty()) {
            classMethod = false;
        } else {
            throw new TypeDeclarationException("class operator '" + op.operator.lexeme + "' uses unknown method "
                    + binding + " of record " + rt.getName());
        }

        List<String> operandTypes = operandKeys(op.operandTypes);
        int selfIndex = withOwner(operandTypes, rt.key(), op.operator.lexeme);
        rt.registerOperator(new OperatorEntry(op.operator.lexeme, operandTypes, binding,
                classMethod ? -1 : selfIndex, classMethod, rt));
    }

    private List<String> operandKeys(List<TypeRef> refs) {
        List<String> keys = new ArrayList<>(refs.size());
        for (TypeRef r : refs) keys.add(interp.resolveType(r).key());
        return keys;
    }

    /** Adds the owner key if missing and returns its position. */
    private static int withOwner(List<String> operandTypes, String ownerKey, String operator) {
        int idx = operandTypes.indexOf(ownerKey);
        if (idx >= 0) return idx;
        if (Names.same(operator, "in")) {
            operandTypes.add(ownerKey);
            return operandTypes.size() - 1;
        }
        operandTypes.add(0, ownerKey);
        return 0;
    }

    // -------------------------
    // Records, interfaces, enums, aliases
    // -------------------------

    Value declareRecord(Statement.RecordDecl decl) {
        try {
            RecordType rt = new RecordType(decl.name.lexeme);
            interp.types.registerRecord(rt);

            for (Statement.FieldDecl f : decl.fields) {
                rt.addField(new FieldInfo(f.name.lexeme, fieldType(f), f.initializer, rt.getName()));
            }
            for (Statement.FunctionDecl m : decl.methods) {
                rt.addMethod(MethodInfo.fromDecl(rt, m));
            }
            for (Statement.PropertyDecl p : decl.properties) {
                PropertyInfo prop = property(p);
                checkAccessor(p, p.readSpec, rt.findField(p.readSpec) != null || !rt.findMethods(p.readSpec).isEmpty());
                checkAccessor(p, p.writeSpec, rt.findField(p.writeSpec) != null || !rt.findMethods(p.writeSpec).isEmpty());
                rt.addProperty(prop);
            }
            for (Statement.OperatorDecl op : decl.operators) {
                registerRecordOperator(rt, op);
            }
            return Value.nil();
        } catch (TypeDeclarationException e) {
            return interp.error(decl.name, e.getMessage());
        }
    }

    Value declareInterface(Statement.InterfaceDecl decl) {
        try {
            InterfaceInfo parent = null;
            if (decl.parent != null) {
                parent = interp.types.findInterface(decl.parent.lexeme);
                if (parent == null) throw new TypeDeclarationException("unknown parent interface " + decl.parent.lexeme);
            }
            InterfaceInfo iface = new InterfaceInfo(decl.name.lexeme, parent);
            interp.types.registerInterface(iface);
            for (Statement.FunctionDecl m : decl.methods) {
                iface.addMethod(MethodInfo.fromDecl(iface, m));
            }
            for (Statement.PropertyDecl p : decl.properties) {
                iface.addProperty(property(p));
            }
            return Value.nil();
        } catch (TypeDeclarationException e) {
            return interp.error(decl.name, e.getMessage());
        }
    }

    /** Members without an explicit ordinal continue from the previous one, starting at 0. */
    Value declareEnum(Statement.EnumDecl decl) {
        try {
            EnumType et = new EnumType(decl.name.lexeme);
            long next = 0;
            for (int i = 0; i < decl.members.size(); i++) {
                Long explicit = (decl.ordinals == null || i >= decl.ordinals.size()) ? null : decl.ordinals.get(i);
                long ordinal = explicit != null ? explicit : next;
                et.addMember(decl.members.get(i).lexeme, ordinal);
                next = ordinal + 1;
            }
            interp.types.registerEnum(et);
            return Value.nil();
        } catch (TypeDeclarationException e) {
            return interp.error(decl.name, e.getMessage());
        }
    }

    Value declareAlias(Statement.TypeAlias decl) {
        try {
            interp.types.registerAlias(decl.name.lexeme, interp.resolveType(decl.target));
            return Value.nil();
        } catch (TypeDeclarationException e) {
            return interp.error(decl.name, e.getMessage());
        }
    }

    // -------------------------
    // Global operators and conversions
    // -------------------------

    Value declareOperator(Statement.OperatorDecl decl) {
        try {
            String binding = decl.binding.lexeme;
            if (!interp.functions.containsKey(Names.normalize(binding))) {
                throw new TypeDeclarationException("operator " + decl.operator.lexeme
                        + " uses unknown function " + binding);
            }

            List<String> operandTypes = operandKeys(decl.operandTypes);
            switch (decl.kind) {
                case IMPLICIT:
                case EXPLICIT: {
                    if (operandTypes.size() != 1 || decl.resultType == null) {
                        throw new TypeDeclarationException("conversion operator needs one operand type and a result type");
                    }
                    String to = interp.resolveType(decl.resultType).key();
                    ConversionEntry entry = new ConversionEntry(operandTypes.get(0), to, binding,
                            decl.kind == Statement.OperatorKind.IMPLICIT);
                    interp.types.getConversions().register(entry);
                    Debug.get().d(TAG, "registered " + entry);
                    break;
                }
                default: {
                    OperatorEntry entry = new OperatorEntry(decl.operator.lexeme, operandTypes, binding, -1, false, null);
                    interp.types.getGlobalOperators().register(entry);
                    Debug.get().d(TAG, "registered global operator " + entry);
                    break;
                }
            }
            return Value.nil();
        } catch (TypeDeclarationException e) {
            return interp.error(decl.operator, e.getMessage());
        }
    }
}
