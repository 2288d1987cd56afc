import com.delphine.script.DelphineScript;
import com.delphine.script.RunResult;
import com.delphine.script.ScriptRuntimeException;
import com.delphine.script.ast.Statement.Stmt;
import com.delphine.script.runtime.Value;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.delphine.script.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class DelphineScriptCoreTest {

    private static RunResult run(Stmt... stmts) {
        return new DelphineScript().run(program(stmts));
    }

    private static String failure(Stmt... stmts) {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> run(stmts));
        return e.getMessage();
    }

    @Test
    void arithmetic_follows_the_tree() {
        RunResult r = run(
                var("a", t("Integer"), bin(lit(2), "+", bin(lit(3), "*", lit(4)))),
                var("b", bin(lit(7), "div", lit(2))),
                var("c", bin(lit(7), "mod", lit(2))),
                var("d", bin(lit(7), "/", lit(2)))
        );

        assertEquals(14L, r.global("a").asInteger());
        assertEquals(3L, r.global("b").asInteger());
        assertEquals(1L, r.global("c").asInteger());
        assertEquals(Value.Type.FLOAT, r.global("d").getType());
        assertEquals(3.5, r.global("d").asFloat(), 0.0);
    }

    @Test
    void division_by_zero_is_a_script_error() {
        String msg = failure(var("x", bin(lit(1), "div", lit(0))));
        assertTrue(msg.startsWith("division by zero"), msg);
    }

    @Test
    void undefined_identifier_carries_its_position() {
        String msg = failure(var("x", id("missing")));
        assertTrue(msg.startsWith("undefined identifier: missing at line "), msg);
    }

    @Test
    void and_short_circuits_on_booleans() {
        RunResult r = run(
                var("called", lit(false)),
                func("Touch", noParams(), "Boolean",
                        assign("called", lit(true)),
                        assign("Result", lit(true))),
                var("x", bin(lit(false), "and", call("Touch"))),
                var("y", bin(lit(true), "or", call("Touch")))
        );

        assertFalse(r.global("x").asBool());
        assertTrue(r.global("y").asBool());
        assertFalse(r.global("called").asBool());
    }

    @Test
    void while_and_repeat_loops() {
        RunResult r = run(
                var("i", lit(1)),
                var("sum", lit(0)),
                whileDo(bin(id("i"), "<=", lit(10)), block(
                        assign("sum", bin(id("sum"), "+", id("i"))),
                        assign("i", bin(id("i"), "+", lit(1))))),
                var("n", lit(0)),
                repeat(bin(id("n"), ">=", lit(3)),
                        assign("n", bin(id("n"), "+", lit(1))))
        );

        assertEquals(55L, r.global("sum").asInteger());
        assertEquals(3L, r.global("n").asInteger());
    }

    @Test
    void for_loop_honours_break_and_continue() {
        RunResult r = run(
                var("s", lit(0)),
                forTo("i", lit(1), lit(10), block(
                        ifThen(bin(bin(id("i"), "mod", lit(2)), "=", lit(0)), cont()),
                        ifThen(bin(id("i"), ">", lit(7)), brk()),
                        assign("s", bin(id("s"), "+", id("i"))))),
                var("digits", lit("")),
                forDownto("j", lit(3), lit(1),
                        assign("digits", bin(id("digits"), "+", call("IntToStr", id("j")))))
        );

        assertEquals(16L, r.global("s").asInteger());
        assertEquals("321", r.global("digits").asString());
    }

    @Test
    void for_loop_over_enum_members() {
        RunResult r = run(
                enumOf("TColor", "Red", "Green", "Blue"),
                enumOf("TLevel", Arrays.asList("Lo", "Hi"), Arrays.asList(null, 10L)),
                var("total", lit(0)),
                forTo("c", id("Red"), id("Blue"),
                        assign("total", bin(id("total"), "+", call("Ord", id("c"))))),
                var("hi", call("Ord", mem(id("TLevel"), "Hi"))),
                var("first", t("TColor"))
        );

        assertEquals(3L, r.global("total").asInteger());
        assertEquals(10L, r.global("hi").asInteger());
        assertEquals("Red", r.global("first").asEnum().getName());
    }

    @Test
    void case_matches_ranges_and_strings() {
        RunResult r = run(
                var("grade", lit("")),
                caseOf(lit(85), assign("grade", lit("C")),
                        branch(assign("grade", lit("A")), range(lit(90), lit(100))),
                        branch(assign("grade", lit("B")), range(lit(80), lit(89)))),
                var("kind", lit("")),
                caseOf(lit("beta"), null,
                        branch(assign("kind", lit("first")), lit("alpha")),
                        branch(assign("kind", lit("greek")), lit("beta"), lit("gamma"))),
                var("fallback", lit("")),
                caseOf(lit(5), assign("fallback", lit("else")),
                        branch(assign("fallback", lit("one")), lit(1)))
        );

        assertEquals("B", r.global("grade").asString());
        assertEquals("greek", r.global("kind").asString());
        assertEquals("else", r.global("fallback").asString());
    }

    @Test
    void for_in_over_a_string_walks_code_points() {
        RunResult r = run(
                var("count", lit(0)),
                var("last", lit("")),
                forIn("ch", lit("aé😀"), block(
                        assign("count", bin(id("count"), "+", lit(1))),
                        assign("last", id("ch"))))
        );

        assertEquals(3L, r.global("count").asInteger());
        assertEquals("😀", r.global("last").asString());
    }

    @Test
    void string_index_returns_the_kth_character() {
        RunResult r = run(
                var("s", lit("a😀b")),
                var("second", idx(id("s"), lit(2))),
                var("third", idx(id("s"), lit(3))),
                var("len", call("Length", id("s")))
        );

        assertEquals("😀", r.global("second").asString());
        assertEquals("b", r.global("third").asString());
        assertEquals(3L, r.global("len").asInteger());
    }

    @Test
    void string_index_out_of_bounds_reports_length() {
        String msg = failure(
                var("s", lit("a😀b")),
                var("c", idx(id("s"), lit(4)))
        );
        assertTrue(msg.startsWith("string index out of bounds: 4 (string length is 3)"), msg);
    }

    @Test
    void string_character_assignment_writes_back() {
        RunResult r = run(
                var("s", lit("cat")),
                assign(idx(id("s"), lit(1)), lit("b"))
        );
        assertEquals("bat", r.global("s").asString());
    }

    @Test
    void exit_with_value_leaves_the_function() {
        RunResult r = run(
                func("Pick", params(param("n", "Integer")), "Integer",
                        ifThen(bin(id("n"), ">", lit(0)), exit(lit(1))),
                        assign("Result", un("-", lit(1)))),
                var("a", call("Pick", lit(5))),
                var("b", call("Pick", lit(-5)))
        );

        assertEquals(1L, r.global("a").asInteger());
        assertEquals(-1L, r.global("b").asInteger());
    }

    @Test
    void function_name_is_an_alias_for_result() {
        RunResult r = run(
                func("Twice", params(param("n", "Integer")), "Integer",
                        assign("Twice", bin(id("n"), "*", lit(2)))),
                var("x", call("Twice", lit(4)))
        );
        assertEquals(8L, r.global("x").asInteger());
    }

    @Test
    void compound_assignment() {
        RunResult r = run(
                var("x", lit(10)),
                compound(id("x"), "+=", lit(5)),
                compound(id("x"), "-=", lit(3)),
                compound(id("x"), "*=", lit(2)),
                var("s", lit("ab")),
                compound(id("s"), "+=", lit("c"))
        );

        assertEquals(24L, r.global("x").asInteger());
        assertEquals("abc", r.global("s").asString());
    }

    @Test
    void break_outside_a_loop_is_an_error() {
        String msg = failure(brk());
        assertTrue(msg.startsWith("break outside of a loop"), msg);
    }

    @Test
    void exit_with_value_at_top_level_is_an_error() {
        String msg = failure(exit(lit(1)));
        assertTrue(msg.startsWith("Exit with a value outside of a function"), msg);
    }

    @Test
    void bare_exit_stops_the_top_level() {
        RunResult r = run(
                var("x", lit(1)),
                exit(),
                assign("x", lit(2))
        );
        assertEquals(1L, r.global("x").asInteger());
    }

    @Test
    void typed_variable_rejects_incompatible_value() {
        String msg = failure(
                var("s", t("String")),
                assign("s", lit(5))
        );
        assertTrue(msg.startsWith("incompatible types: cannot convert Integer to String"), msg);
    }

    @Test
    void integer_widens_to_float() {
        RunResult r = run(var("f", t("Float"), lit(3)));
        assertEquals(Value.Type.FLOAT, r.global("f").getType());
        assertEquals(3.0, r.global("f").asFloat(), 0.0);
    }

    @Test
    void untyped_variable_keeps_its_initial_type() {
        String msg = failure(
                var("n", lit(1)),
                assign("n", lit("one"))
        );
        assertTrue(msg.startsWith("incompatible types: cannot convert String to Integer"), msg);
    }

    @Test
    void names_are_case_insensitive() {
        RunResult r = run(
                var("Counter", lit(1)),
                assign("COUNTER", bin(id("counter"), "+", lit(1)))
        );
        assertEquals(2L, r.global("counter").asInteger());
    }

    @Test
    void block_declarations_do_not_leak() {
        RunResult r = run(
                var("x", lit(1)),
                block(var("x", lit(2)), var("inner", lit(3)))
        );

        assertEquals(1L, r.global("x").asInteger());
        assertNull(r.global("inner"));
    }

    @Test
    void condition_must_be_boolean() {
        String msg = failure(ifThen(lit(1), expr(lit(0))));
        assertTrue(msg.startsWith("condition must be Boolean, got Integer"), msg);
    }

    @Test
    void println_writes_to_the_run_buffer() {
        RunResult r = run(
                println(lit("a"), lit(1), lit(true)),
                expr(call("Print", lit(2.5)))
        );
        assertEquals("a1True\n2.5", r.output());
    }

    @Test
    void println_writes_to_host_output_when_set() {
        StringBuilder out = new StringBuilder();
        RunResult r = new DelphineScript().setOutput(out).run(program(println(lit("hello"))));

        assertNull(r.output());
        assertEquals("hello\n", out.toString());
    }

    @Test
    void evaluate_runs_a_single_expression() {
        Value v = new DelphineScript().evaluate(bin(lit(6), "*", lit(7)));
        assertEquals(42L, v.asInteger());
    }
}
