import com.delphine.script.DelphineScript;
import com.delphine.script.RunResult;
import com.delphine.script.ScriptRuntimeException;
import com.delphine.script.ast.Statement.Stmt;
import com.delphine.script.host.HostCallback;
import com.delphine.script.host.HostExport;
import com.delphine.script.runtime.ArrayValue;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.delphine.script.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class DelphineScriptHostTest {

    public static class Tools {
        final List<String> log = new ArrayList<>();

        @HostExport
        public long add(long a, long b) {
            return a + b;
        }

        @HostExport("Join")
        public String join(String sep, String... parts) {
            return String.join(sep, parts);
        }

        @HostExport
        public void record(String line) {
            log.add(line);
        }

        @HostExport
        public void explode() {
            throw new IllegalStateException("broken");
        }

        @HostExport
        public long applyTwice(HostCallback fn, long seed) {
            Object once = fn.call(List.of(seed));
            return (Long) fn.call(List.of(once));
        }

        public long notExported() {
            return 0;
        }
    }

    private static RunResult run(DelphineScript engine, Stmt... stmts) {
        return engine.run(program(stmts));
    }

    @Test
    void untyped_host_function_receives_natural_java_values() {
        List<Object> seen = new ArrayList<>();
        DelphineScript engine = new DelphineScript().registerHostFunction("Capture", 3, args -> {
            seen.addAll(args);
            return "ok";
        });

        RunResult r = run(engine,
                var("reply", call("Capture", lit(7), lit("s"), arr(lit(1), lit(2))))
        );

        assertEquals("ok", r.global("reply").asString());
        assertEquals(7L, seen.get(0));
        assertEquals("s", seen.get(1));
        assertEquals(Arrays.asList(1L, 2L), seen.get(2));
    }

    @Test
    void records_reach_the_host_as_maps() {
        List<Object> seen = new ArrayList<>();
        DelphineScript engine = new DelphineScript().registerHostFunction("Capture", 1, args -> {
            seen.add(args.get(0));
            return null;
        });

        run(engine,
                record("TPair").field("Key", "String").field("Count", "Integer").build(),
                expr(call("Capture", rec("TPair", "Key", lit("k"), "Count", lit(3))))
        );

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("Key", "k");
        expected.put("Count", 3L);
        assertEquals(expected, seen.get(0));
    }

    @Test
    void exported_methods_are_callable_by_name() {
        Tools tools = new Tools();
        DelphineScript engine = new DelphineScript().registerHostMethods(tools);

        RunResult r = run(engine,
                var("sum", call("Add", lit(2), lit(40))),
                var("joined", call("Join", lit("-"), lit("a"), lit("b"), lit("c"))),
                expr(call("record", lit("hello")))
        );

        assertEquals(42L, r.global("sum").asInteger());
        assertEquals("a-b-c", r.global("joined").asString());
        assertEquals(List.of("hello"), tools.log);
        assertTrue(engine.hostFunctions().has("add"));
        assertFalse(engine.hostFunctions().has("notExported"));
    }

    @Test
    void wrong_argument_type_is_an_error() {
        DelphineScript engine = new DelphineScript().registerHostMethods(new Tools());
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class,
                () -> run(engine, var("x", call("Add", lit("two"), lit(1)))));
        assertTrue(e.getMessage().startsWith("host function add: cannot pass String as long"), e.getMessage());
    }

    @Test
    void wrong_argument_count_is_an_error() {
        DelphineScript engine = new DelphineScript().registerHostMethods(new Tools());
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class,
                () -> run(engine, var("x", call("Add", lit(1)))));
        assertTrue(e.getMessage().startsWith("host function add expects 2 argument(s), got 1"), e.getMessage());
    }

    @Test
    void host_exceptions_become_catchable_ehost() {
        DelphineScript engine = new DelphineScript().registerHostMethods(new Tools());

        RunResult r = run(engine,
                var("msg", lit("")),
                var("javaClass", lit("")),
                tryExcept(stmts(expr(call("Explode"))),
                        on("E", "EHost", block(
                                assign("msg", mem(id("E"), "Message")),
                                assign("javaClass", mem(id("E"), "ExceptionClass")))))
        );

        assertEquals("broken", r.global("msg").asString());
        assertEquals("java.lang.IllegalStateException", r.global("javaClass").asString());
    }

    @Test
    void host_can_call_back_into_the_script() {
        DelphineScript engine = new DelphineScript().registerHostMethods(new Tools());

        RunResult r = run(engine,
                var("calls", lit(0)),
                var("result", call("ApplyTwice",
                        lambda(params(param("n", "Integer")), t("Integer"),
                                compound(id("calls"), "+=", lit(1)),
                                assign("Result", bin(id("n"), "*", lit(3)))),
                        lit(2)))
        );

        assertEquals(18L, r.global("result").asInteger());
        assertEquals(2L, r.global("calls").asInteger());
    }

    @Test
    void exception_raised_in_a_callback_propagates_to_the_script() {
        DelphineScript engine = new DelphineScript().registerHostMethods(new Tools());

        RunResult r = run(engine,
                var("caught", lit("")),
                tryExcept(stmts(expr(call("ApplyTwice",
                                lambda(params(param("n", "Integer")), t("Integer"),
                                        raise(create("ERangeError", lit("too far")))),
                                lit(1)))),
                        on("E", "ERangeError", assign("caught", mem(id("E"), "Message"))))
        );

        assertEquals("too far", r.global("caught").asString());
    }

    @Test
    void list_results_become_dynamic_arrays() {
        DelphineScript engine = new DelphineScript()
                .registerHostFunction("Names", 0, args -> List.of("ann", "bob"));

        RunResult r = run(engine,
                var("names", call("Names")),
                var("count", call("Length", id("names"))),
                var("second", idx(id("names"), lit(1)))
        );

        ArrayValue names = r.global("names").asArray();
        assertTrue(names.getType().isDynamic());
        assertEquals(2L, r.global("count").asInteger());
        assertEquals("bob", r.global("second").asString());
    }

    @Test
    void map_results_become_json() {
        DelphineScript engine = new DelphineScript().registerHostFunction("Config", 0, args -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("port", 8080);
            m.put("hosts", List.of("a", "b"));
            return m;
        });

        RunResult r = run(engine,
                var("cfg", call("Config")),
                var("port", mem(id("cfg"), "port")),
                var("host", idx(mem(id("cfg"), "hosts"), lit(1))),
                var("absent", mem(id("cfg"), "missing"))
        );

        assertEquals(8080L, r.global("port").asInteger());
        assertEquals("b", r.global("host").asString());
        assertTrue(r.global("absent").isNil());
    }

    @Test
    void parse_json_navigates_objects_and_arrays() {
        RunResult r = run(new DelphineScript(),
                var("doc", call("ParseJSON", lit("{\"name\":\"x\",\"tags\":[1,2,3],\"ok\":true}"))),
                var("name", mem(id("doc"), "name")),
                var("tag", idx(mem(id("doc"), "tags"), lit(2))),
                var("outside", idx(mem(id("doc"), "tags"), lit(9))),
                var("missing", idx(id("doc"), lit("nothing"))),
                var("ok", mem(id("doc"), "ok")),
                var("text", call("JSONStringify", mem(id("doc"), "tags")))
        );

        assertEquals("x", r.global("name").asString());
        assertEquals(3L, r.global("tag").asInteger());
        assertTrue(r.global("outside").isNil());
        assertTrue(r.global("missing").isNil());
        assertTrue(r.global("ok").asBool());
        assertEquals("[1,2,3]", r.global("text").asString());
    }

    @Test
    void malformed_json_raises_econvert_error() {
        RunResult r = run(new DelphineScript(),
                var("caught", lit(false)),
                tryExcept(stmts(var("doc", call("ParseJSON", lit("{broken")))),
                        on("E", "EConvertError", assign("caught", lit(true))))
        );
        assertTrue(r.global("caught").asBool());
    }

    @Test
    void duplicate_host_names_are_rejected() {
        DelphineScript engine = new DelphineScript().registerHostFunction("Twin", 0, args -> null);
        assertThrows(IllegalArgumentException.class, () -> engine.registerHostFunction("TWIN", 1, args -> null));
    }
}
