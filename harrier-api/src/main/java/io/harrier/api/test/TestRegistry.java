package io.harrier.api.test;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Holds every test known to a run, in registration order.
 * <p>
 * Registration order is the source order: ordered modules run their tests in
 * the order they were registered here.
 * <pre>{@code
 * var registry = new TestRegistry();
 * registry.test("health", "ping", ctx -> Checks.check(client.ping(), "ping"));
 * registry.serial("database", "users", "insert_user", ctx -> { ... });
 * registry.ordered("checkout", m -> m
 *     .test("add_to_cart", ctx -> { ... })
 *     .test("pay", ctx -> { ... }));
 * }</pre>
 */
public class TestRegistry {

    public static final String DEFAULT_SERIAL_GROUP = "default";

    private static final Logger log = LoggerFactory.getLogger(TestRegistry.class);

    private final Map<String, TestDescriptor> tests = new LinkedHashMap<>();
    private final Set<String> fullNames = new HashSet<>();
    private final AtomicLong rank = new AtomicLong();

    /**
     * Register a test that may run concurrently with everything else.
     */
    public TestRegistry test(String module, String name, TestBody body) {
        return register(new TestDescriptor(new TestInfo(module, name, 0, name), TestOrdering.unordered(), null, body));
    }

    /**
     * Register a test in the default serial group.
     */
    public TestRegistry serial(String module, String name, TestBody body) {
        return serial(DEFAULT_SERIAL_GROUP, module, name, body);
    }

    /**
     * Register a test that never runs at the same time as other tests of the same group
     * (within one project).
     */
    public TestRegistry serial(String group, String module, String name, TestBody body) {
        Objects.requireNonNull(group, "group");
        return register(new TestDescriptor(new TestInfo(module, name, 0, name), TestOrdering.unordered(), group, body));
    }

    /**
     * Register a module whose tests run one by one, in the order they are added.
     */
    public TestRegistry ordered(String module, Consumer<OrderedModule> tests) {
        tests.accept(new OrderedModule(module));
        return this;
    }

    /**
     * Register one test variant per case.
     * <p>
     * Without a label the case name is derived from the parameters; a derived
     * name already taken in the module gets the case index appended. Duplicate
     * explicit labels are rejected.
     */
    public synchronized <P> TestRegistry parameterized(String module, String name, List<TestCase<P>> cases, ParameterizedBody<P> body) {
        if (cases.isEmpty()) {
            throw new IllegalArgumentException("Parameterized test " + module + "::" + name + " has no cases");
        }
        for (int i = 0; i < cases.size(); i++) {
            TestCase<P> testCase = cases.get(i);
            String displayName = testCase.label() != null
                    ? name + "::" + testCase.label()
                    : derivedName(module, name + "::" + stringify(testCase.parameters()), i);
            P parameters = testCase.parameters();
            register(new TestDescriptor(new TestInfo(module, name, i, displayName), TestOrdering.unordered(), null,
                    ctx -> body.execute(ctx, parameters)));
        }
        return this;
    }

    /**
     * Register a fully built descriptor.
     *
     * @throws IllegalArgumentException if a test with the same identity or the same
     *                                  {@code module::displayName} is already registered
     */
    public synchronized TestRegistry register(TestDescriptor descriptor) {
        TestInfo info = descriptor.info();
        String key = info.module() + "::" + info.function() + "#" + info.variant();
        if (tests.containsKey(key)) {
            throw new IllegalArgumentException("Test already registered: " + info.fullName());
        }
        if (!fullNames.add(info.fullName())) {
            throw new IllegalArgumentException("Another test is already registered as " + info.fullName());
        }
        tests.put(key, descriptor);
        log.debug("Registered test {}", descriptor);
        return this;
    }

    /**
     * @return all registered tests in registration order
     */
    public synchronized List<TestDescriptor> list() {
        return List.copyOf(tests.values());
    }

    public synchronized int size() {
        return tests.size();
    }

    private String derivedName(String module, String displayName, int index) {
        String candidate = displayName;
        int suffix = index;
        while (fullNames.contains(module + "::" + candidate)) {
            candidate = displayName + "_" + suffix++;
        }
        return candidate;
    }

    private static String stringify(Object parameters) {
        String raw = parameters instanceof Collection<?>
                ? String.join("_", ((Collection<?>) parameters).stream().map(String::valueOf).toList())
                : String.valueOf(parameters);
        String sanitized = raw.replaceAll("[^A-Za-z0-9]+", "_").replaceAll("^_+|_+$", "");
        return sanitized.isEmpty() ? "case" : sanitized;
    }

    /**
     * Collects the tests of one ordered module.
     */
    public final class OrderedModule {

        private final String module;

        private OrderedModule(String module) {
            this.module = Objects.requireNonNull(module, "module");
        }

        public OrderedModule test(String name, TestBody body) {
            register(new TestDescriptor(new TestInfo(module, name, 0, name),
                    TestOrdering.ordered(module, rank.getAndIncrement()), null, body));
            return this;
        }
    }
}
