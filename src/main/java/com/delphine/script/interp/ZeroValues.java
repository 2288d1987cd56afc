package com.delphine.script.interp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.delphine.script.ast.Token;
import com.delphine.script.runtime.ArrayValue;
import com.delphine.script.runtime.EnumValue;
import com.delphine.script.runtime.Environment;
import com.delphine.script.runtime.JsonValues;
import com.delphine.script.runtime.ObjectInstance;
import com.delphine.script.runtime.RecordValue;
import com.delphine.script.runtime.SetValue;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ArrayType;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.DataType;
import com.delphine.script.types.EnumType;
import com.delphine.script.types.FieldInfo;
import com.delphine.script.types.RecordType;
import com.delphine.script.types.SetType;

/** Default values of declared types, plus fresh object and record construction. */
final class ZeroValues {

    private final Interpreter interp;

    ZeroValues(Interpreter interp) {
        this.interp = interp;
    }

    /**
     * Zero value of a type. Records are built fresh on every call; the result
     * is an ERROR only when a record field initializer fails.
     */
    Value zeroOf(DataType t) {
        if (t == null) return Value.nil();
        switch (t.getKind()) {
            case INTEGER: return Value.integer(0);
            case FLOAT: return Value.floating(0.0);
            case STRING: return Value.string("");
            case BOOLEAN: return Value.bool(false);
            case VARIANT: return Value.variant(Value.nil());
            case JSON: return Value.json(JsonValues.toJson(Value.nil()));
            case ENUM: {
                EnumType et = (EnumType) t;
                if (et.getMemberNames().isEmpty()) return Value.nil();
                String first = et.getMemberNames().get(0);
                return Value.enumValue(new EnumValue(et, first, et.ordinalOf(first)));
            }
            case ARRAY: {
                ArrayType at = (ArrayType) t;
                if (at.isDynamic()) return Value.array(new ArrayValue(at, null));
                List<Value> elems = new ArrayList<>(at.size());
                for (int i = 0; i < at.size(); i++) {
                    Value z = zeroOf(at.getElementType());
                    if (z.isError()) return z;
                    elems.add(z);
                }
                return Value.array(new ArrayValue(at, elems));
            }
            case SET:
                return Value.set(new SetValue((SetType) t));
            case RECORD:
                return newRecord((RecordType) t, null);
            default:
                return Value.nil();
        }
    }

    /** A record with every field at its initializer or zero value. */
    Value newRecord(RecordType rt, Token at) {
        RecordValue rec = new RecordValue(rt);
        for (FieldInfo f : rt.getFields().values()) {
            Value v = initialFieldValue(f, at);
            if (v.isError()) return v;
            rec.setField(f.getName(), v);
        }
        return Value.record(rec);
    }

    /** Instance with zeroed fields only; used for runtime-built exception objects. */
    ObjectInstance blank(ClassInfo cls) {
        ObjectInstance obj = new ObjectInstance(cls);
        for (FieldInfo f : cls.getFields().values()) {
            obj.setField(f.getName(), zeroOf(f.getType()));
        }
        return obj;
    }

    /** Instance with declared field initializers applied, evaluated in the global scope. */
    Value instantiate(ClassInfo cls, Token at) {
        ObjectInstance obj = new ObjectInstance(cls);
        for (Map.Entry<String, FieldInfo> e : cls.getFields().entrySet()) {
            Value v = initialFieldValue(e.getValue(), at);
            if (interp.aborted(v)) return v;
            obj.setField(e.getValue().getName(), v);
        }
        return Value.object(obj);
    }

    private Value initialFieldValue(FieldInfo f, Token at) {
        if (f.getInitializer() == null) return zeroOf(f.getType());

        Environment previous = interp.env;
        interp.env = interp.state.globals;
        Value v;
        try {
            v = interp.evaluateWithExpected(f.getInitializer(), f.getType());
        } finally {
            interp.env = previous;
        }
        if (interp.aborted(v)) return v;
        return interp.coercion.coerce(v, f.getType(), at).copyForAssignment();
    }
}
