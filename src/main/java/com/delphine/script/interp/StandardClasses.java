package com.delphine.script.interp;

import java.util.Collections;
import java.util.EnumSet;

import com.delphine.script.ast.Statement.Directive;
import com.delphine.script.runtime.ObjectInstance;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.FieldInfo;
import com.delphine.script.types.MethodInfo;
import com.delphine.script.types.PrimitiveType;
import com.delphine.script.types.TypeRegistry;

/** Registers TObject, Exception and the runtime's exception classes into a fresh registry. */
final class StandardClasses {

    static final String[] EXCEPTION_CLASSES = {
            "EConvertError", "ERangeError", "EDivByZero", "EAssertionFailed",
            "EInvalidOp", "EInvalidCast", "EScriptStackOverflow"
    };

    private final Interpreter interp;

    StandardClasses(Interpreter interp) {
        this.interp = interp;
    }

    void register(TypeRegistry types) {
        ClassInfo tobject = tobject();
        declare(types, tobject);

        ClassInfo exception = new ClassInfo("Exception", tobject, false);
        exception.addField(new FieldInfo("Message", PrimitiveType.STRING, null, "Exception"));
        exception.addMethod(MethodInfo.nativeMethod(exception, "Create", 1, 1, EnumSet.of(Directive.CONSTRUCTOR),
                (self, args) -> {
                    self.asObject().setField("Message", Value.string(args.get(0).unwrapVariant().display()));
                    return Value.nil();
                }));
        declare(types, exception);

        for (String name : EXCEPTION_CLASSES) {
            declare(types, new ClassInfo(name, exception, false));
        }

        ClassInfo host = new ClassInfo("EHost", exception, false);
        host.addField(new FieldInfo("ExceptionClass", PrimitiveType.STRING, null, "EHost"));
        declare(types, host);
    }

    private static void declare(TypeRegistry types, ClassInfo cls) {
        types.registerClass(cls);
        cls.buildVirtualMethodTable();
    }

    private ClassInfo tobject() {
        ClassInfo c = new ClassInfo("TObject", null, false);

        c.addMethod(MethodInfo.nativeMethod(c, "Create", 0, 0, EnumSet.of(Directive.CONSTRUCTOR),
                (self, args) -> Value.nil()));

        c.addMethod(MethodInfo.nativeMethod(c, "Destroy", 0, 0,
                EnumSet.of(Directive.DESTRUCTOR, Directive.VIRTUAL), (self, args) -> Value.nil()));

        // Free is nil-safe and dispatches to the most-derived destructor
        c.addMethod(MethodInfo.nativeMethod(c, "Free", 0, 0, null, (self, args) -> {
            ObjectInstance obj = self == null ? null : self.objectOrNull();
            if (obj == null) return Value.nil();
            MethodInfo destructor = obj.getClassInfo().getDestructor();
            if (destructor == null) return Value.nil();
            return interp.invoker.callMethod(obj.getClassInfo().resolveVirtual(destructor), Value.object(obj),
                    Collections.emptyList(), null, interp.state.currentNode);
        }));

        c.addMethod(MethodInfo.nativeMethod(c, "ClassName", 0, 0, null,
                (self, args) -> Value.string(self.objectOrNull().getClassInfo().getName())));
        c.addMethod(MethodInfo.nativeMethod(c, "ClassName", 0, 0, EnumSet.of(Directive.CLASS_METHOD),
                (self, args) -> Value.string(self.asClass().getName())));
        return c;
    }
}
