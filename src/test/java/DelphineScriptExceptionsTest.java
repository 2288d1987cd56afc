import com.delphine.script.DelphineScript;
import com.delphine.script.RunResult;
import com.delphine.script.ScriptRuntimeException;
import com.delphine.script.UncaughtScriptException;
import com.delphine.script.ast.Expr.ExprInterface;
import com.delphine.script.ast.Statement.Stmt;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.delphine.script.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class DelphineScriptExceptionsTest {

    private static RunResult run(Stmt... stmts) {
        return new DelphineScript().run(program(stmts));
    }

    private static String failure(Stmt... stmts) {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> run(stmts));
        return e.getMessage();
    }

    private static Stmt append(String var, String piece) {
        return append(var, lit(piece));
    }

    private static Stmt append(String var, ExprInterface piece) {
        return assign(var, bin(id(var), "+", piece));
    }

    @Test
    void first_matching_handler_wins_even_if_less_specific() {
        RunResult r = run(
                var("which", lit("")),
                tryExcept(stmts(raise(create("EConvertError", lit("bad")))),
                        on("E", "Exception", assign("which", lit("base"))),
                        on("E", "EConvertError", assign("which", lit("specific"))))
        );
        assertEquals("base", r.global("which").asString());
    }

    @Test
    void unmatched_exception_reaches_the_outer_handler() {
        RunResult r = run(
                var("which", lit("")),
                tryExcept(stmts(
                                tryExcept(stmts(raise(create("ERangeError", lit("r")))),
                                        on("E", "EConvertError", assign("which", lit("inner"))))),
                        on("E", "ERangeError", assign("which", bin(lit("outer:"), "+", mem(id("E"), "Message")))))
        );
        assertEquals("outer:r", r.global("which").asString());
    }

    @Test
    void else_block_catches_what_no_handler_matched() {
        RunResult r = run(
                var("which", lit("")),
                tryExceptElse(stmts(raise(create("EInvalidOp", lit("op")))),
                        stmts(assign("which", bin(lit("else:"), "+", mem(id("ExceptObject"), "Message")))),
                        on("E", "EConvertError", assign("which", lit("convert"))))
        );
        assertEquals("else:op", r.global("which").asString());
    }

    @Test
    void empty_except_clause_swallows_the_exception() {
        RunResult r = run(
                var("after", lit(false)),
                tryCatchAll(stmts(raise(create("Exception", lit("x")))), null),
                assign("after", lit(true))
        );
        assertTrue(r.global("after").asBool());
    }

    @Test
    void statements_after_a_raise_are_skipped() {
        RunResult r = run(
                var("log", lit("")),
                tryCatchAll(stmts(
                                append("log", "a"),
                                raise(create("Exception", lit("stop"))),
                                append("log", "b")),
                        stmts(append("log", "c")))
        );
        assertEquals("ac", r.global("log").asString());
    }

    @Test
    void finally_runs_after_normal_completion() {
        RunResult r = run(
                var("log", lit("")),
                tryFinally(stmts(append("log", "body;")), stmts(append("log", "finally;")))
        );
        assertEquals("body;finally;", r.global("log").asString());
    }

    @Test
    void finally_runs_while_an_exception_propagates() {
        RunResult r = run(
                var("log", lit("")),
                tryExcept(stmts(
                                tryFinally(stmts(raise(create("Exception", lit("boom")))),
                                        stmts(append("log", "fin;")))),
                        on("E", "Exception", append("log", mem(id("E"), "Message"))))
        );
        assertEquals("fin;boom", r.global("log").asString());
    }

    @Test
    void exception_raised_in_finally_replaces_the_original() {
        RunResult r = run(
                var("cls", lit("")),
                var("msg", lit("")),
                tryExcept(stmts(
                                tryFinally(stmts(raise(create("EConvertError", lit("first")))),
                                        stmts(raise(create("ERangeError", lit("second")))))),
                        on("E", "Exception", block(
                                assign("cls", mcall(id("E"), "ClassName")),
                                assign("msg", mem(id("E"), "Message")))))
        );

        assertEquals("ERangeError", r.global("cls").asString());
        assertEquals("second", r.global("msg").asString());
    }

    @Test
    void finally_runs_when_exit_leaves_the_function() {
        RunResult r = run(
                var("log", lit("")),
                func("Early", noParams(), "Integer",
                        tryFinally(stmts(exit(lit(1)), assign("Result", lit(2))),
                                stmts(append("log", "cleanup")))),
                var("got", call("Early"))
        );

        assertEquals(1L, r.global("got").asInteger());
        assertEquals("cleanup", r.global("log").asString());
    }

    @Test
    void bare_raise_reraises_the_handled_exception() {
        RunResult r = run(
                var("log", lit("")),
                tryExcept(stmts(
                                tryExcept(stmts(raise(create("EConvertError", lit("x")))),
                                        on("E", "Exception", block(append("log", "inner;"), reraise())))),
                        on("E", "EConvertError", append("log", "outer")))
        );
        assertEquals("inner;outer", r.global("log").asString());
    }

    @Test
    void bare_raise_outside_a_handler_is_an_error() {
        String msg = failure(reraise());
        assertTrue(msg.startsWith("bare raise with no active exception"), msg);
    }

    @Test
    void raise_requires_an_object() {
        String msg = failure(raise(lit(5)));
        assertTrue(msg.startsWith("raise requires an exception object, got Integer"), msg);
    }

    @Test
    void user_exception_classes_carry_their_fields() {
        RunResult r = run(
                cls("EValidation").parent("Exception").field("Code", "Integer").build(),
                var("code", lit(0)),
                var("msg", lit("")),
                tryExcept(stmts(
                                var("err", create("EValidation", lit("invalid input"))),
                                assign(mem(id("err"), "Code"), lit(42)),
                                raise(id("err"))),
                        on("V", "EValidation", block(
                                assign("code", mem(id("V"), "Code")),
                                assign("msg", mem(id("V"), "Message")))))
        );

        assertEquals(42L, r.global("code").asInteger());
        assertEquals("invalid input", r.global("msg").asString());
    }

    @Test
    void uncaught_exception_is_thrown_to_the_host() {
        UncaughtScriptException e = assertThrows(UncaughtScriptException.class,
                () -> run(raise(create("EConvertError", lit("nope")))));

        assertEquals("EConvertError", e.getExceptionClass());
        assertEquals("nope", e.getScriptMessage());
        assertTrue(e.getMessage().startsWith("uncaught EConvertError: nope"), e.getMessage());
    }

    @Test
    void uncaught_exception_records_the_script_stack() {
        UncaughtScriptException e = assertThrows(UncaughtScriptException.class, () -> run(
                proc("Inner", noParams(), raise(create("Exception", lit("deep")))),
                proc("Outer", noParams(), expr(call("Inner"))),
                expr(call("Outer"))
        ));

        List<String> stack = e.getScriptStack();
        assertEquals(2, stack.size(), stack.toString());
        assertTrue(stack.get(0).startsWith("Inner"), stack.toString());
        assertTrue(stack.get(1).startsWith("Outer"), stack.toString());
    }

    @Test
    void reporter_receives_failures_instead_of_throwing() {
        List<String> kinds = new ArrayList<>();
        List<ScriptRuntimeException> seen = new ArrayList<>();
        DelphineScript engine = new DelphineScript().setErrorReporter((failure, kind, entry) -> {
            kinds.add(kind);
            seen.add(failure);
        });

        RunResult raised = engine.run(program(raise(create("ERangeError", lit("r")))));
        RunResult broken = engine.run(program(var("x", id("missing"))));

        assertEquals(List.of("exception", "error"), kinds);
        assertTrue(raised.failure() instanceof UncaughtScriptException);
        assertSame(seen.get(1), broken.failure());
        assertTrue(broken.failure().getMessage().startsWith("undefined identifier: missing"));
    }

    @Test
    void runtime_errors_pass_through_handlers_but_finally_still_runs() {
        List<String> kinds = new ArrayList<>();
        RunResult r = new DelphineScript()
                .setErrorReporter((failure, kind, entry) -> kinds.add(kind))
                .run(program(
                        var("handled", lit(false)),
                        var("cleaned", lit(false)),
                        tryFinally(stmts(
                                        tryCatchAll(stmts(var("x", bin(lit(1), "div", lit(0)))),
                                                stmts(assign("handled", lit(true))))),
                                stmts(assign("cleaned", lit(true))))
                ));

        assertEquals(List.of("error"), kinds);
        assertTrue(r.failure().getMessage().startsWith("division by zero"));
        assertFalse(r.global("handled").asBool());
        assertTrue(r.global("cleaned").asBool());
    }

    @Test
    void recursion_limit_raises_a_catchable_exception() {
        RunResult r = new DelphineScript().setMaxRecursionDepth(50).run(program(
                func("Down", params(param("N", "Integer")), "Integer",
                        assign("Result", call("Down", bin(id("N"), "+", lit(1))))),
                var("caught", lit("")),
                tryExcept(stmts(expr(call("Down", lit(0)))),
                        on("E", "EScriptStackOverflow", assign("caught", mem(id("E"), "Message"))))
        ));
        assertEquals("Maximal recursion exceeded (50)", r.global("caught").asString());
    }

    @Test
    void uncaught_recursion_limit_reaches_the_host() {
        UncaughtScriptException e = assertThrows(UncaughtScriptException.class,
                () -> new DelphineScript().setMaxRecursionDepth(20).run(program(
                        proc("Loop", noParams(), expr(call("Loop"))),
                        expr(call("Loop"))
                )));
        assertEquals("EScriptStackOverflow", e.getExceptionClass());
    }

    @Test
    void builtins_raise_conversion_and_assertion_exceptions() {
        RunResult r = run(
                var("convert", lit("")),
                var("assertion", lit("")),
                var("custom", lit("")),
                tryExcept(stmts(var("n", call("StrToInt", lit("x")))),
                        on("E", "EConvertError", assign("convert", mem(id("E"), "Message")))),
                tryExcept(stmts(expr(call("Assert", lit(false)))),
                        on("E", "EAssertionFailed", assign("assertion", mem(id("E"), "Message")))),
                tryExcept(stmts(expr(call("Assert", bin(lit(1), "=", lit(2)), lit("one is not two")))),
                        on("E", "Exception", assign("custom", mem(id("E"), "Message"))))
        );

        assertEquals("'x' is not a valid integer value", r.global("convert").asString());
        assertEquals("Assertion failed", r.global("assertion").asString());
        assertEquals("one is not two", r.global("custom").asString());
    }

    @Test
    void except_object_is_nil_outside_handlers() {
        RunResult r = run(
                var("outside", is(id("ExceptObject"), "Exception")),
                var("inside", lit(false)),
                tryCatchAll(stmts(raise(create("Exception", lit("e")))),
                        stmts(assign("inside", is(id("ExceptObject"), "Exception"))))
        );

        assertFalse(r.global("outside").asBool());
        assertTrue(r.global("inside").asBool());
    }
}
