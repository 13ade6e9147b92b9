package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.NodeArena;
import info.isaksson.erland.constructtiers.ir.NodeKind;
import info.isaksson.erland.constructtiers.ir.SourceLocation;

import java.util.Map;

/** Hand-built trees for the python conformance snippets. */
final class Fixtures {

    private Fixtures() {}

    /** Small DSL over {@link NodeArena.Builder} that stamps one line per snippet. */
    static final class Tree {
        final NodeArena.Builder b;
        final String file;
        int line = 1;
        int col = 1;

        Tree(String file) {
            this.file = file;
            this.b = NodeArena.builder(file).language("python");
        }

        SourceLocation here() {
            return SourceLocation.at(file, line, col++);
        }

        int name(String n) {
            return b.add(NodeKind.NAME, Map.of("name", n), here());
        }

        int lit(String v) {
            return b.add(NodeKind.LITERAL, Map.of("value", v), here());
        }

        int bin(String op, int left, int right) {
            return b.add(NodeKind.BINARY_OP, Map.of("op", op), here(), left, right);
        }

        int compare(int... operands) {
            return b.add(NodeKind.COMPARE, here(), operands);
        }

        int node(NodeKind kind, int... children) {
            return b.add(kind, here(), children);
        }

        int node(NodeKind kind, Map<String, String> attrs, int... children) {
            return b.add(kind, attrs, here(), children);
        }

        int expr(int value) {
            return b.add(NodeKind.EXPR, here(), value);
        }

        Tree nextLine() {
            line++;
            col = 1;
            return this;
        }

        NodeArena module(int... statements) {
            b.add(NodeKind.MODULE, SourceLocation.at(file, 1, 1), statements);
            return b.build();
        }
    }

    /** {@code x < 100}. */
    static NodeArena binaryComparison() {
        Tree t = new Tree("core/comparisons.py");
        return t.module(t.expr(t.compare(t.name("x"), t.lit("100"))));
    }

    /** {@code 0 < x < 100}. */
    static NodeArena chainedComparison() {
        Tree t = new Tree("core/comparisons.py");
        return t.module(t.expr(t.compare(t.lit("0"), t.name("x"), t.lit("100"))));
    }

    /** {@code [x * 2 for x in numbers]} as the only statement. */
    static NodeArena comprehension() {
        Tree t = new Tree("extended/comprehensions.py");
        return t.module(t.expr(listComprehension(t)));
    }

    static int listComprehension(Tree t) {
        int element = t.bin("*", t.name("x"), t.lit("2"));
        return t.node(NodeKind.COMPREHENSION, Map.of("form", "list"), element, t.name("x"), t.name("numbers"));
    }

    /** {@code (x + 5) * 2} where the {@code 5} is replaced by a list comprehension. */
    static NodeArena arithmeticAroundComprehension() {
        Tree t = new Tree("core/arithmetic.py");
        int comp = listComprehension(t);
        int sum = t.bin("+", t.name("x"), comp);
        int product = t.bin("*", sum, t.lit("2"));
        return t.module(t.expr(product));
    }

    /** {@code (x + 5) * 2}. */
    static NodeArena arithmetic() {
        Tree t = new Tree("core/arithmetic.py");
        int sum = t.bin("+", t.name("x"), t.lit("5"));
        return t.module(t.expr(t.bin("*", sum, t.lit("2"))));
    }

    /** {@code @decorator} on foo, then {@code @decorator(arg1, arg2)} on baz. */
    static NodeArena decorators() {
        Tree t = new Tree("native/decorators.py");
        int bare = t.node(NodeKind.DECORATOR, Map.of("name", "decorator"));
        int foo = t.node(NodeKind.FUNCTION_DEF, Map.of("name", "foo"), bare, t.node(NodeKind.PASS));
        t.nextLine();
        int withArgs = t.node(NodeKind.DECORATOR, Map.of("name", "decorator", "arguments", "2"), t.name("arg1"), t.name("arg2"));
        int baz = t.node(NodeKind.FUNCTION_DEF, Map.of("name", "baz"), withArgs, t.node(NodeKind.PASS));
        return t.module(foo, baz);
    }

    /**
     * {@code @retry(times=3, delay=1)} on fetch, from a front end that keeps the argument list as
     * text, then a decorator whose front end reports an empty argument list.
     */
    static NodeArena decoratorsWithArgumentText() {
        Tree t = new Tree("native/decorator_text.py");
        int retry = t.node(NodeKind.DECORATOR, Map.of("name", "retry", "arguments", "times=3, delay=1"));
        int fetch = t.node(NodeKind.FUNCTION_DEF, Map.of("name", "fetch"), retry, t.node(NodeKind.PASS));
        t.nextLine();
        int none = t.node(NodeKind.DECORATOR, Map.of("name", "cache", "arguments", ""));
        int load = t.node(NodeKind.FUNCTION_DEF, Map.of("name", "load"), none, t.node(NodeKind.PASS));
        return t.module(fetch, load);
    }

    /** One assignment {@code name = name} per given identifier, in order. */
    static NodeArena assignments(String file, String... names) {
        Tree t = new Tree(file);
        int[] statements = new int[names.length];
        for (int i = 0; i < names.length; i++) {
            statements[i] = t.node(NodeKind.ASSIGN, t.name(names[i]), t.name(names[i]));
            t.nextLine();
        }
        return t.module(statements);
    }

    /** {@code async def f(): return x + 5}. */
    static NodeArena asyncWrappingArithmetic() {
        Tree t = new Tree("native/async_await.py");
        int sum = t.bin("+", t.name("x"), t.lit("5"));
        int ret = t.node(NodeKind.RETURN, sum);
        return t.module(t.node(NodeKind.ASYNC_FUNCTION_DEF, Map.of("name", "f"), ret));
    }

    /** {@code async def fetch_data(): result = await api_call(); return result}. */
    static NodeArena asyncFetch() {
        Tree t = new Tree("native/async_await.py");
        int call = t.node(NodeKind.CALL, t.name("api_call"));
        int await = t.node(NodeKind.AWAIT, call);
        int assign = t.node(NodeKind.ASSIGN, t.name("result"), await);
        t.nextLine();
        int ret = t.node(NodeKind.RETURN, t.name("result"));
        return t.module(t.node(NodeKind.ASYNC_FUNCTION_DEF, Map.of("name", "fetch_data"), assign, ret));
    }

    /** {@code class Child(Parent): pass} and {@code class Multi(Base1, Base2): attribute = 42}. */
    static NodeArena classes() {
        Tree t = new Tree("native/classes.py");
        int child = t.node(NodeKind.CLASS_DEF, Map.of("name", "Child", "bases", "1"), t.name("Parent"), t.node(NodeKind.PASS));
        t.nextLine();
        int assign = t.node(NodeKind.ASSIGN, t.name("attribute"), t.lit("42"));
        int multi = t.node(NodeKind.CLASS_DEF, Map.of("name", "Multi", "bases", "2"), t.name("Base1"), t.name("Base2"), assign);
        return t.module(child, multi);
    }

    /** try / except Exception as e / handle_error(e). */
    static NodeArena tryExcept() {
        Tree t = new Tree("extended/exception_handling.py");
        int body = t.expr(t.node(NodeKind.CALL, t.name("risky_operation")));
        t.nextLine();
        int handlerBody = t.expr(t.node(NodeKind.CALL, t.name("handle_error"), t.name("e")));
        int handler = t.node(NodeKind.EXCEPT_HANDLER, Map.of("type", "Exception", "name", "e"), handlerBody);
        return t.module(t.node(NodeKind.TRY, body, handler));
    }
}
