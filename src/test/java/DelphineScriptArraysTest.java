import com.delphine.script.DelphineScript;
import com.delphine.script.RunResult;
import com.delphine.script.ScriptRuntimeException;
import com.delphine.script.ast.Statement.Stmt;
import com.delphine.script.runtime.ArrayValue;
import com.delphine.script.runtime.Value;

import org.junit.jupiter.api.Test;

import static com.delphine.script.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class DelphineScriptArraysTest {

    private static RunResult run(Stmt... stmts) {
        return new DelphineScript().run(program(stmts));
    }

    private static String failure(Stmt... stmts) {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> run(stmts));
        return e.getMessage();
    }

    private static long intAt(ArrayValue a, int physical) {
        return a.getPhysical(physical).asInteger();
    }

    @Test
    void static_array_accepts_every_index_in_bounds() {
        RunResult r = run(
                var("a", statArr(1, 5, t("Integer"))),
                forTo("i", lit(1), lit(5), assign(idx(id("a"), id("i")), bin(id("i"), "*", id("i")))),
                var("sum", lit(0)),
                forTo("j", lit(1), lit(5), compound(id("sum"), "+=", idx(id("a"), id("j"))))
        );
        assertEquals(55L, r.global("sum").asInteger());
    }

    @Test
    void static_array_below_low_bound_reports_index_and_bounds() {
        String msg = failure(
                var("a", statArr(1, 5, t("Integer"))),
                var("x", idx(id("a"), lit(0)))
        );
        assertTrue(msg.startsWith("array index out of bounds: 0 (bounds are 1..5)"), msg);
    }

    @Test
    void static_array_above_high_bound_is_an_error() {
        String msg = failure(
                var("a", statArr(1, 5, t("Integer"))),
                assign(idx(id("a"), lit(6)), lit(1))
        );
        assertTrue(msg.startsWith("array index out of bounds: 6 (bounds are 1..5)"), msg);
    }

    @Test
    void dynamic_array_range_is_zero_to_length_minus_one() {
        RunResult r = run(
                var("d", dynArr(t("Integer")), arr(lit(10), lit(20), lit(30))),
                var("first", idx(id("d"), lit(0))),
                var("last", idx(id("d"), lit(2)))
        );
        assertEquals(10L, r.global("first").asInteger());
        assertEquals(30L, r.global("last").asInteger());

        String past = failure(
                var("d", dynArr(t("Integer")), arr(lit(10), lit(20), lit(30))),
                var("x", idx(id("d"), lit(3)))
        );
        assertTrue(past.startsWith("array index out of bounds: 3 (array length is 3)"), past);

        String negative = failure(
                var("d", dynArr(t("Integer")), arr(lit(10))),
                var("x", idx(id("d"), lit(-1)))
        );
        assertTrue(negative.startsWith("array index out of bounds: -1 (array length is 1)"), negative);
    }

    @Test
    void static_arrays_copy_on_assignment() {
        RunResult r = run(
                var("a", statArr(0, 2, t("Integer")), arr(lit(1), lit(2), lit(3))),
                var("b", id("a")),
                assign(idx(id("b"), lit(0)), lit(99))
        );

        assertEquals(1L, intAt(r.global("a").asArray(), 0));
        assertEquals(99L, intAt(r.global("b").asArray(), 0));
    }

    @Test
    void dynamic_arrays_alias_on_assignment() {
        RunResult r = run(
                var("d", dynArr(t("Integer")), arr(lit(1), lit(2))),
                var("e", id("d")),
                assign(idx(id("e"), lit(0)), lit(7)),
                expr(mcall(id("e"), "Add", lit(3)))
        );

        ArrayValue d = r.global("d").asArray();
        assertSame(d, r.global("e").asArray());
        assertEquals(3, d.length());
        assertEquals(7L, intAt(d, 0));
    }

    @Test
    void array_literal_unifies_integer_and_float() {
        RunResult r = run(var("xs", arr(lit(1), lit(2.5), lit(3))));

        ArrayValue xs = r.global("xs").asArray();
        assertTrue(xs.getType().isStatic());
        assertEquals(3, xs.length());
        double[] expected = {1.0, 2.5, 3.0};
        for (int i = 0; i < expected.length; i++) {
            assertEquals(Value.Type.FLOAT, xs.getPhysical(i).getType());
            assertEquals(expected[i], xs.getPhysical(i).asFloat(), 0.0);
        }
    }

    @Test
    void array_literal_with_unrelated_types_cannot_be_inferred() {
        String msg = failure(var("xs", arr(lit(1), lit("two"))));
        assertTrue(msg.startsWith("array literal element 2 has type String, incompatible with Integer"), msg);
    }

    @Test
    void array_literal_element_must_convert_to_the_expected_type() {
        String msg = failure(var("xs", dynArr(t("Integer")), arr(lit(1), lit("x"))));
        assertTrue(msg.startsWith("array element 2 has incompatible type (got String, expected Integer)"), msg);
    }

    @Test
    void array_literal_for_a_static_array_must_fill_it() {
        String msg = failure(var("xs", statArr(1, 3, t("Integer")), arr(lit(1), lit(2))));
        assertTrue(msg.startsWith("array literal has 2 elements, expected 3"), msg);
    }

    @Test
    void nil_element_needs_a_reference_element_type() {
        String msg = failure(var("xs", dynArr(t("Integer")), arr(lit(1), nil())));
        assertTrue(msg.startsWith("cannot assign nil to Integer"), msg);
    }

    @Test
    void array_literal_takes_its_own_annotation() {
        RunResult r = run(var("xs", arrOf(dynArr(t("Float")), lit(1), lit(2))));

        ArrayValue xs = r.global("xs").asArray();
        assertTrue(xs.getType().isDynamic());
        assertEquals(Value.Type.FLOAT, xs.getPhysical(1).getType());
    }

    @Test
    void dynamic_array_methods() {
        RunResult r = run(
                var("d", dynArr(t("Integer")), arr()),
                expr(mcall(id("d"), "Add", lit(5))),
                expr(mcall(id("d"), "Add", lit(6))),
                expr(mcall(id("d"), "Push", lit(7))),
                expr(mcall(id("d"), "Delete", lit(0))),
                var("where", mcall(id("d"), "IndexOf", lit(7))),
                var("missing", mcall(id("d"), "IndexOf", lit(42))),
                expr(mcall(id("d"), "SetLength", lit(4))),
                var("len", call("Length", id("d")))
        );

        ArrayValue d = r.global("d").asArray();
        assertEquals(4, d.length());
        assertEquals(6L, intAt(d, 0));
        assertEquals(7L, intAt(d, 1));
        assertEquals(0L, intAt(d, 3));
        assertEquals(1L, r.global("where").asInteger());
        assertEquals(-1L, r.global("missing").asInteger());
        assertEquals(4L, r.global("len").asInteger());
    }

    @Test
    void static_arrays_cannot_grow() {
        String msg = failure(
                var("a", statArr(0, 1, t("Integer"))),
                expr(mcall(id("a"), "Add", lit(1)))
        );
        assertTrue(msg.startsWith("cannot add to a static array"), msg);
    }

    @Test
    void bounds_builtins_follow_the_declared_range() {
        RunResult r = run(
                var("a", statArr(3, 7, t("Integer"))),
                var("lo", call("Low", id("a"))),
                var("hi", call("High", id("a"))),
                var("n", call("Length", id("a"))),
                var("count", mem(id("a"), "Count"))
        );

        assertEquals(3L, r.global("lo").asInteger());
        assertEquals(7L, r.global("hi").asInteger());
        assertEquals(5L, r.global("n").asInteger());
        assertEquals(5L, r.global("count").asInteger());
    }

    @Test
    void grown_slots_read_as_zero_values() {
        RunResult r = run(
                var("names", dynArr(t("String"))),
                expr(call("SetLength", id("names"), lit(2))),
                var("first", idx(id("names"), lit(0)))
        );
        assertEquals("", r.global("first").asString());
    }

    @Test
    void set_length_beyond_the_maximum_raises_range_error() {
        RunResult r = run(
                var("d", dynArr(t("Integer")), arr(lit(1))),
                var("builtin", lit("")),
                var("method", lit("")),
                tryExcept(stmts(expr(call("SetLength", id("d"), lit(4294967295L)))),
                        on("E", "ERangeError", assign("builtin", mem(id("E"), "Message")))),
                tryExcept(stmts(expr(mcall(id("d"), "SetLength", lit(4294967295L)))),
                        on("E", "ERangeError", assign("method", mem(id("E"), "Message")))),
                var("len", call("Length", id("d")))
        );

        assertTrue(r.global("builtin").asString().startsWith("array length 4294967295 exceeds"),
                r.global("builtin").asString());
        assertTrue(r.global("method").asString().startsWith("array length 4294967295 exceeds"),
                r.global("method").asString());
        assertEquals(1L, r.global("len").asInteger());
    }

    @Test
    void membership_with_in() {
        RunResult r = run(
                var("yes", bin(lit(2), "in", arr(lit(1), lit(2), lit(3)))),
                var("no", bin(lit(9), "in", arr(lit(1), lit(2), lit(3))))
        );
        assertTrue(r.global("yes").asBool());
        assertFalse(r.global("no").asBool());
    }

    @Test
    void for_in_over_array() {
        RunResult r = run(
                var("total", lit(0)),
                forIn("x", arr(lit(4), lit(5), lit(6)), compound(id("total"), "+=", id("x")))
        );
        assertEquals(15L, r.global("total").asInteger());
    }

    @Test
    void nested_static_arrays_store_in_place() {
        RunResult r = run(
                var("grid", statArr(0, 1, statArr(0, 2, t("Integer")))),
                assign(idx(id("grid"), lit(1), lit(2)), lit(5)),
                var("v", idx(id("grid"), lit(1), lit(2))),
                var("other", idx(id("grid"), lit(0), lit(2)))
        );

        assertEquals(5L, r.global("v").asInteger());
        assertEquals(0L, r.global("other").asInteger());
    }

    @Test
    void index_must_be_ordinal() {
        String msg = failure(
                var("a", statArr(0, 1, t("Integer"))),
                var("x", idx(id("a"), lit("k")))
        );
        assertTrue(msg.startsWith("index must be an ordinal value, got String"), msg);
    }

    @Test
    void indexing_nil_is_an_error_not_a_crash() {
        String msg = failure(
                var("v", t("Variant")),
                var("x", idx(id("v"), lit(0)))
        );
        assertTrue(msg.startsWith("cannot index nil value"), msg);
    }

    @Test
    void arrays_compare_element_wise() {
        RunResult r = run(var("same", bin(arr(lit(1), lit(2)), "=", arr(lit(1), lit(2)))));
        assertTrue(r.global("same").asBool());
    }
}
