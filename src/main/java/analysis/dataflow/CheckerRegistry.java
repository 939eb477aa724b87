package analysis.dataflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checkers available to a run, by name. A run may enable several checkers; they are composed into one
 * {@link ProductDomain} so that they share a single traversal of each procedure.
 */
public final class CheckerRegistry {

    /**
     * Creates a fresh checker instance
     */
    public interface CheckerFactory {
        Checker<?, ?> create();
    }

    private final Map<String, CheckerFactory> factories = new LinkedHashMap<>();

    /**
     * Make a checker available under a name
     *
     * @param name
     *            name used on the command line
     * @param factory
     *            creates the checker
     * @throws IllegalArgumentException
     *             if the name is already taken
     */
    public void register(String name, CheckerFactory factory) {
        if (factories.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate checker " + name);
        }
        factories.put(name, factory);
    }

    public List<String> getNames() {
        return Collections.unmodifiableList(new ArrayList<>(factories.keySet()));
    }

    /**
     * Create the checker registered under the name
     *
     * @param name
     *            checker name
     * @return new checker
     * @throws IllegalArgumentException
     *             if no checker has that name
     */
    public Checker<?, ?> create(String name) {
        CheckerFactory f = factories.get(name);
        if (f == null) {
            throw new IllegalArgumentException("Unknown checker \"" + name + "\", known checkers are "
                    + factories.keySet());
        }
        return f.create();
    }

    /**
     * A single checker running all the named ones. The name of the result is the names joined with "+".
     *
     * @param names
     *            non-empty list of checker names
     * @return composed checker
     */
    public Checker<?, ?> compose(List<String> names) {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("No checker selected");
        }
        Checker<?, ?> result = create(names.get(0));
        for (int i = 1; i < names.size(); i++) {
            result = product(result, create(names.get(i)));
        }
        return result;
    }

    private static <D1, S1, D2, S2> Checker<?, ?> product(Checker<D1, S1> c1, Checker<D2, S2> c2) {
        return new Checker<>(c1.getName() + "+" + c2.getName(), new ProductDomain<>(c1.getDomain(), c2.getDomain()));
    }

    @Override
    public String toString() {
        return "CheckerRegistry" + factories.keySet();
    }
}
