import com.delphine.script.DelphineScript;
import com.delphine.script.RunResult;
import com.delphine.script.ScriptRuntimeException;
import com.delphine.script.ast.Statement.Stmt;
import com.delphine.script.runtime.Value;

import org.junit.jupiter.api.Test;

import static com.delphine.script.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class DelphineScriptSetsTest {

    private static RunResult run(Stmt... stmts) {
        Stmt[] all = new Stmt[stmts.length + 2];
        all[0] = enumOf("TColor", "Red", "Green", "Blue");
        all[1] = alias("TColors", setOf(t("TColor")));
        System.arraycopy(stmts, 0, all, 2, stmts.length);
        return new DelphineScript().run(program(all));
    }

    private static String failure(Stmt... stmts) {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> run(stmts));
        return e.getMessage();
    }

    private static String shown(RunResult r, String name) {
        return r.global(name).display();
    }

    @Test
    void literal_in_set_context_builds_a_set() {
        RunResult r = run(
                var("warm", t("TColors"), arr(id("Green"), id("Red"), id("Green"))),
                var("none", t("TColors"), arr()),
                var("blank", t("TColors"))
        );

        assertEquals(Value.Type.SET, r.global("warm").getType());
        assertEquals("[Red, Green]", shown(r, "warm"));
        assertEquals(2, r.global("warm").asSet().size());
        assertTrue(r.global("none").asSet().isEmpty());
        assertTrue(r.global("blank").asSet().isEmpty());
        assertEquals("set of TColor", r.global("blank").typeName());
    }

    @Test
    void membership_union_difference_intersection() {
        RunResult r = run(
                var("warm", t("TColors"), arr(id("Red"), id("Green"))),
                var("cool", t("TColors"), arr(id("Green"), id("Blue"))),
                var("hasRed", bin(id("Red"), "in", id("warm"))),
                var("hasBlue", bin(id("Blue"), "in", id("warm"))),
                var("both", bin(id("warm"), "+", id("cool"))),
                var("onlyWarm", bin(id("warm"), "-", id("cool"))),
                var("shared", bin(id("warm"), "*", id("cool"))),
                var("same", bin(id("warm"), "=", arr(id("Green"), id("Red")))),
                var("differ", bin(id("warm"), "<>", id("cool"))),
                var("subset", bin(id("shared"), "<=", id("warm"))),
                var("superset", bin(id("both"), ">=", id("cool")))
        );

        assertTrue(r.global("hasRed").asBool());
        assertFalse(r.global("hasBlue").asBool());
        assertEquals("[Red, Green, Blue]", shown(r, "both"));
        assertEquals("[Red]", shown(r, "onlyWarm"));
        assertEquals("[Green]", shown(r, "shared"));
        assertTrue(r.global("same").asBool());
        assertTrue(r.global("differ").asBool());
        assertTrue(r.global("subset").asBool());
        assertTrue(r.global("superset").asBool());
    }

    @Test
    void include_and_exclude_mutate_the_variable() {
        RunResult r = run(
                var("s", t("TColors")),
                expr(call("Include", id("s"), id("Blue"))),
                expr(mcall(id("s"), "Include", id("Red"))),
                expr(call("Include", id("s"), id("Red"))),
                var("snapshot", id("s")),
                expr(call("Exclude", id("s"), id("Blue"))),
                compound(id("s"), "+=", arr(id("Green")))
        );

        assertEquals("[Red, Green]", shown(r, "s"));
        assertEquals("[Red, Blue]", shown(r, "snapshot"));
    }

    @Test
    void sets_are_copied_on_assignment_and_into_parameters() {
        RunResult r = run(
                proc("Fill", params(param("Target", "TColors")),
                        expr(call("Include", id("Target"), id("Blue")))),
                proc("FillVar", params(varParam("Target", "TColors")),
                        expr(call("Include", id("Target"), id("Green")))),
                var("a", t("TColors"), arr(id("Red"))),
                var("b", t("TColors"), id("a")),
                expr(call("Include", id("b"), id("Green"))),
                expr(call("Fill", id("a"))),
                var("c", t("TColors"), arr()),
                expr(call("FillVar", id("c")))
        );

        assertEquals("[Red]", shown(r, "a"));
        assertEquals("[Red, Green]", shown(r, "b"));
        assertEquals("[Green]", shown(r, "c"));
    }

    @Test
    void for_in_visits_members_in_ordinal_order() {
        RunResult r = run(
                var("s", t("TColors"), arr(id("Blue"), id("Red"))),
                var("seen", lit("")),
                forIn("c", id("s"), compound(id("seen"), "+=", call("IntToStr", call("Ord", id("c")))))
        );
        assertEquals("02", r.global("seen").asString());
    }

    @Test
    void integer_sets() {
        RunResult r = run(
                var("primes", setOf(t("Integer")), arr(lit(2), lit(3), lit(5), lit(7))),
                var("odd", setOf(t("Integer")), arr(lit(1), lit(3), lit(5), lit(7), lit(9))),
                var("oddPrimes", bin(id("primes"), "*", id("odd"))),
                var("hasFive", bin(lit(5), "in", id("primes"))),
                var("hasNine", bin(lit(9), "in", id("primes")))
        );

        assertEquals("[3, 5, 7]", shown(r, "oddPrimes"));
        assertTrue(r.global("hasFive").asBool());
        assertFalse(r.global("hasNine").asBool());
    }

    @Test
    void element_of_the_wrong_type_is_rejected() {
        String msg = failure(
                enumOf("TFruit", "Apple", "Pear"),
                var("s", t("TColors"), arr(id("Red"), id("Pear")))
        );
        assertTrue(msg.startsWith("set element 2 has type TFruit, expected TColor"), msg);
    }

    @Test
    void membership_across_element_types_is_not_applicable() {
        String msg = failure(
                enumOf("TFruit", "Apple", "Pear"),
                var("s", t("TColors"), arr(id("Red"))),
                var("x", bin(id("Apple"), "in", id("s")))
        );
        assertTrue(msg.startsWith("operator in not applicable to TFruit and set of TColor"), msg);
    }

    @Test
    void set_of_a_non_ordinal_type_is_rejected() {
        String msg = failure(var("s", setOf(t("String"))));
        assertTrue(msg.startsWith("set element type must be an enumeration or Integer, got String"), msg);
    }

    @Test
    void include_checks_the_element_type() {
        String msg = failure(
                var("s", t("TColors")),
                expr(call("Include", id("s"), lit(1)))
        );
        assertTrue(msg.startsWith("Include expects a TColor element, got Integer"), msg);
    }
}
