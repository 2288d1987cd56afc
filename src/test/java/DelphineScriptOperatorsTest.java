import com.delphine.script.DelphineScript;
import com.delphine.script.RunResult;
import com.delphine.script.ScriptRuntimeException;
import com.delphine.script.ast.Statement.Directive;
import com.delphine.script.ast.Statement.Stmt;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static com.delphine.script.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class DelphineScriptOperatorsTest {

    private static RunResult run(Stmt... stmts) {
        return new DelphineScript().run(program(stmts));
    }

    private static String failure(Stmt... stmts) {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> run(stmts));
        return e.getMessage();
    }

    private static Stmt money() {
        return cls("TMoney")
                .field("Amount", "Integer")
                .method(ctor("Create", params(param("AAmount", "Integer")), assign("Amount", id("AAmount"))))
                .method(func("Plus", params(param("Other", "TMoney")), "TMoney",
                        assign("Result", create("TMoney", bin(id("Amount"), "+", mem(id("Other"), "Amount"))))))
                .method(func("Less", params(param("Other", "TMoney")), "Boolean",
                        assign("Result", bin(id("Amount"), "<", mem(id("Other"), "Amount")))))
                .operator(operator("+", "Plus", "TMoney", "TMoney", "TMoney"))
                .operator(operator("<", "Less", "Boolean", "TMoney", "TMoney"))
                .build();
    }

    @Test
    void class_operator_binds_to_an_instance_method() {
        RunResult r = run(
                money(),
                var("ten", create("TMoney", lit(10))),
                var("five", create("TMoney", lit(5))),
                var("sum", bin(id("ten"), "+", id("five"))),
                var("total", mem(id("sum"), "Amount")),
                var("smaller", bin(id("five"), "<", id("ten")))
        );

        assertEquals(15L, r.global("total").asInteger());
        assertTrue(r.global("smaller").asBool());
    }

    @Test
    void class_operator_accepts_subclass_operands() {
        RunResult r = run(
                money(),
                cls("TEuro").parent("TMoney").build(),
                var("euros", create("TEuro", lit(5))),
                var("plain", create("TMoney", lit(7))),
                var("sum", bin(id("euros"), "+", id("plain"))),
                var("total", mem(id("sum"), "Amount"))
        );
        assertEquals(12L, r.global("total").asInteger());
    }

    @Test
    void global_operator_extends_primitive_types() {
        RunResult r = run(
                func("Repeat", params(param("S", "String"), param("N", "Integer")), "String",
                        assign("Result", lit("")),
                        forTo("i", lit(1), id("N"), assign("Result", bin(id("Result"), "+", id("S"))))),
                operator("*", "Repeat", "String", "String", "Integer"),
                var("line", bin(lit("ab"), "*", lit(3)))
        );
        assertEquals("ababab", r.global("line").asString());
    }

    @Test
    void global_operator_needs_a_declared_function() {
        String msg = failure(operator("*", "Nowhere", "String", "String", "Integer"));
        assertTrue(msg.startsWith("operator * uses unknown function Nowhere"), msg);
    }

    @Test
    void class_operator_needs_a_declared_method() {
        String msg = failure(
                cls("TBroken")
                        .operator(operator("+", "Missing", "TBroken", "TBroken", "TBroken"))
                        .build()
        );
        assertTrue(msg.startsWith("class operator '+' uses unknown method Missing of class TBroken"), msg);
    }

    private static Stmt box() {
        return cls("TBox")
                .field("N", "Integer")
                .method(ctor("Create", params(param("AN", "Integer")), assign("N", id("AN"))))
                .method(method("Combine", params(param("A", "TBox"), param("B", "TBox")), "TBox",
                        EnumSet.of(Directive.CLASS_METHOD),
                        assign("Result", create("TBox", bin(mem(id("A"), "N"), "+", mem(id("B"), "N"))))))
                .method(func("Negate", noParams(), "TBox",
                        assign("Result", create("TBox", un("-", id("N"))))))
                .operator(operator("+", "Combine", "TBox", "TBox", "TBox"))
                .operator(operator("-", "Negate", "TBox", "TBox"))
                .build();
    }

    @Test
    void class_operator_binds_to_a_class_method() {
        RunResult r = run(
                box(),
                var("two", create("TBox", lit(2))),
                var("three", create("TBox", lit(3))),
                var("sum", bin(id("two"), "+", id("three"))),
                var("total", mem(id("sum"), "N"))
        );
        assertEquals(5L, r.global("total").asInteger());
    }

    @Test
    void unary_class_operator() {
        RunResult r = run(
                box(),
                var("a", create("TBox", lit(2))),
                var("negated", un("-", id("a"))),
                var("value", mem(id("negated"), "N")),
                var("original", mem(id("a"), "N"))
        );
        assertEquals(-2L, r.global("value").asInteger());
        assertEquals(2L, r.global("original").asInteger());
    }

    @Test
    void record_operator_binds_to_an_instance_method() {
        RunResult r = run(
                record("TVec")
                        .field("X", "Integer")
                        .field("Y", "Integer")
                        .method(func("Scale", params(param("K", "Integer")), "TVec",
                                assign("Result", rec("TVec",
                                        "X", bin(id("X"), "*", id("K")),
                                        "Y", bin(id("Y"), "*", id("K"))))))
                        .operator(operator("*", "Scale", "TVec", "TVec", "Integer"))
                        .build(),
                var("v", rec("TVec", "X", lit(2), "Y", lit(3))),
                var("w", bin(id("v"), "*", lit(4))),
                var("wx", mem(id("w"), "X")),
                var("wy", mem(id("w"), "Y")),
                var("vx", mem(id("v"), "X"))
        );

        assertEquals(8L, r.global("wx").asInteger());
        assertEquals(12L, r.global("wy").asInteger());
        assertEquals(2L, r.global("vx").asInteger());
    }

    @Test
    void duplicate_operand_type_tuple_is_rejected() {
        String msg = failure(
                record("TVec")
                        .field("X", "Integer")
                        .method(method("Add", params(param("A", "TVec"), param("B", "TVec")), "TVec",
                                EnumSet.of(Directive.CLASS_METHOD), assign("Result", id("A"))))
                        .method(method("Plus", params(param("A", "TVec"), param("B", "TVec")), "TVec",
                                EnumSet.of(Directive.CLASS_METHOD), assign("Result", id("B"))))
                        .operator(operator("+", "Add", "TVec", "TVec", "TVec"))
                        .operator(operator("+", "Plus", "TVec", "TVec", "TVec"))
                        .build()
        );
        assertTrue(msg.startsWith("class operator '+' already defined for operand types (tvec, tvec)"), msg);
    }

    private static Stmt[] chain() {
        return new Stmt[] {
                record("T1").field("V", "Integer").build(),
                record("T2").field("V", "Integer").build(),
                record("T3").field("V", "Integer").build(),
                record("T4").field("V", "Integer").build(),
                func("IntToT1", params(param("N", "Integer")), "T1",
                        assign("Result", rec("T1", "V", id("N")))),
                func("T1ToT2", params(param("A", "T1")), "T2",
                        assign("Result", rec("T2", "V", bin(mem(id("A"), "V"), "+", lit(1))))),
                func("T2ToT3", params(param("A", "T2")), "T3",
                        assign("Result", rec("T3", "V", bin(mem(id("A"), "V"), "+", lit(1))))),
                func("T3ToT4", params(param("A", "T3")), "T4",
                        assign("Result", rec("T4", "V", bin(mem(id("A"), "V"), "+", lit(1))))),
                implicit("Integer", "T1", "IntToT1"),
                implicit("T1", "T2", "T1ToT2"),
                implicit("T2", "T3", "T2ToT3"),
                implicit("T3", "T4", "T3ToT4")
        };
    }

    private static Stmt[] with(Stmt[] head, Stmt... tail) {
        Stmt[] out = new Stmt[head.length + tail.length];
        System.arraycopy(head, 0, out, 0, head.length);
        System.arraycopy(tail, 0, out, head.length, tail.length);
        return out;
    }

    @Test
    void implicit_conversions_chain_up_to_three_steps() {
        RunResult r = run(with(chain(),
                var("one", t("T1"), lit(5)),
                var("three", t("T3"), lit(5))
        ));

        assertEquals(5L, r.global("one").asRecord().getField("V").asInteger());
        assertEquals(7L, r.global("three").asRecord().getField("V").asInteger());
    }

    @Test
    void four_step_chain_is_not_applied() {
        String msg = failure(with(chain(), var("four", t("T4"), lit(5))));
        assertTrue(msg.startsWith("incompatible types: cannot convert Integer to T4"), msg);
    }

    @Test
    void implicit_conversion_applies_to_arguments() {
        RunResult r = run(with(chain(),
                func("Peek", params(param("A", "T2")), "Integer", assign("Result", mem(id("A"), "V"))),
                var("seen", call("Peek", lit(40)))
        ));
        assertEquals(41L, r.global("seen").asInteger());
    }

    @Test
    void explicit_conversion_only_applies_to_casts() {
        Stmt[] decls = {
                record("TCelsius").field("Deg", "Integer").build(),
                func("CelsiusToInt", params(param("C", "TCelsius")), "Integer",
                        assign("Result", mem(id("C"), "Deg"))),
                explicit("TCelsius", "Integer", "CelsiusToInt"),
                var("warm", rec("TCelsius", "Deg", lit(25)))
        };

        RunResult r = run(with(decls, var("n", call("Integer", id("warm")))));
        assertEquals(25L, r.global("n").asInteger());

        String msg = failure(with(decls, var("n", t("Integer"), id("warm"))));
        assertTrue(msg.startsWith("incompatible types: cannot convert TCelsius to Integer"), msg);
    }

    @Test
    void duplicate_conversion_is_rejected() {
        String msg = failure(with(chain(), implicit("Integer", "T1", "IntToT1")));
        assertTrue(msg.startsWith("implicit conversion already registered: integer -> t1"), msg);
    }
}
